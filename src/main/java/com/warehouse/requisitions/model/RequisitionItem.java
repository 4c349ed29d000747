package com.warehouse.requisitions.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "requisition_items")
@Data
public class RequisitionItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "requisition_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Requisition requisition;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "inventory_item_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private InventoryItem inventoryItem;

    @Column(nullable = false)
    private Integer lineNumber;

    @Column(nullable = false, updatable = false, precision = 14, scale = 3)
    private BigDecimal qtyRequested;

    // Null until the requisition is decided
    @Column(precision = 14, scale = 3)
    private BigDecimal qtyApproved;

    // Granted by the approver but not available in stock
    @Column(nullable = false, precision = 14, scale = 3)
    private BigDecimal shortfall = BigDecimal.ZERO;

    public boolean isFullyApproved() {
        return qtyApproved != null && qtyApproved.compareTo(qtyRequested) == 0;
    }
}
