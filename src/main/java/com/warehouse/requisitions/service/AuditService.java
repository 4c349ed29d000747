package com.warehouse.requisitions.service;

import com.warehouse.requisitions.model.AuditLog;
import com.warehouse.requisitions.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_USER = "SYSTEM";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    // Joins the caller's transaction: the entry commits or rolls back with the change it describes
    @Transactional
    public void log(String username, String action, String details) {
        AuditLog log = new AuditLog();
        log.setUsername(username != null ? username : SYSTEM_USER);
        log.setAction(action);
        log.setDetails(details != null && details.length() > 1000 ? details.substring(0, 1000) : details);
        log.setTimestamp(LocalDateTime.now(clock));
        auditLogRepository.save(log);
        logger.debug("Audit {} by {}: {}", action, log.getUsername(), log.getDetails());
    }
}
