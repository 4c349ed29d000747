package com.warehouse.requisitions.model;

public enum RequisitionStatus {
    PENDING,
    APPROVED,
    PARTIALLY_APPROVED,
    REJECTED,
    // Reserved: no flow transitions into it yet
    CANCELLED;

    public boolean isTerminal() {
        return switch (this) {
            case PENDING -> false;
            case APPROVED, PARTIALLY_APPROVED, REJECTED, CANCELLED -> true;
        };
    }
}
