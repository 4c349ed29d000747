package com.warehouse.requisitions.config;

import com.warehouse.requisitions.service.AuditService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.security.authentication.event.AbstractAuthenticationFailureEvent;
import org.springframework.security.authentication.event.AuthenticationSuccessEvent;
import org.springframework.stereotype.Component;

// HTTP Basic authenticates every request, so only failures go to the audit log
@Component
public class AuthenticationEventListener {

    private static final Logger logger = LoggerFactory.getLogger(AuthenticationEventListener.class);

    private final AuditService auditService;

    public AuthenticationEventListener(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    public void onSuccess(AuthenticationSuccessEvent event) {
        logger.debug("Authenticated {}", event.getAuthentication().getName());
    }

    @EventListener
    public void onFailure(AbstractAuthenticationFailureEvent event) {
        Object principal = event.getAuthentication().getPrincipal();
        String username = principal instanceof String ? (String) principal : "unknown";
        logger.warn("Authentication failed for {}: {}", username, event.getException().getMessage());
        auditService.log(username, "LOGIN_FAILURE", event.getException().getMessage());
    }
}
