package com.warehouse.requisitions.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "requisitions",
        uniqueConstraints = @UniqueConstraint(name = Requisition.CODE_CONSTRAINT, columnNames = "code"))
@Data
public class Requisition {

    public static final String CODE_CONSTRAINT = "uk_requisitions_code";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String code; // REQ-YYYYMMDD-NNNN

    // Associations stay lazy so the row lock query touches this table only
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "requester_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User requester;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "machine_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Machine machine;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "area_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Area area;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private RequisitionStatus status;

    @Column(length = 2000)
    private String note;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @OneToMany(mappedBy = "requisition", cascade = CascadeType.ALL, fetch = FetchType.EAGER)
    @Fetch(FetchMode.SUBSELECT)
    @OrderBy("lineNumber ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<RequisitionItem> items = new ArrayList<>();

    // Append-only
    @OneToMany(mappedBy = "requisition", cascade = CascadeType.ALL, fetch = FetchType.EAGER)
    @Fetch(FetchMode.SUBSELECT)
    @OrderBy("decidedAt ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<Approval> approvals = new ArrayList<>();

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = LocalDateTime.now();
        if (updatedAt == null)
            updatedAt = createdAt;
        if (status == null)
            status = RequisitionStatus.PENDING;
    }

    public void addItem(RequisitionItem item) {
        item.setRequisition(this);
        item.setLineNumber(items.size() + 1);
        items.add(item);
    }

    public void addApproval(Approval approval) {
        approval.setRequisition(this);
        approvals.add(approval);
    }
}
