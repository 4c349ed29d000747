package com.warehouse.requisitions.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs")
@Data
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private String username;

    @Column(nullable = false, updatable = false, length = 50)
    private String action; // e.g. "REQUISITION_SUBMITTED", "STOCK_SHORTFALL"

    @Column(length = 1000, updatable = false)
    private String details; // e.g. "REQ-20250101-0001, items: 2"

    @Column(nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null)
            timestamp = LocalDateTime.now();
    }
}
