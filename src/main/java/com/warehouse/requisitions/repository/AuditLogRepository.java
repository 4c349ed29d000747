package com.warehouse.requisitions.repository;

import com.warehouse.requisitions.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findByActionOrderByTimestampDesc(String action);
}
