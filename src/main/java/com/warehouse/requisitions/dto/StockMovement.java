package com.warehouse.requisitions.dto;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of one ledger decrement. {@code applied + shortfall == requested}.
 */
@Value
public class StockMovement {
    Long inventoryItemId;
    String sku;
    BigDecimal requested;
    BigDecimal applied;
    BigDecimal shortfall;
    BigDecimal stockAfter;

    public boolean hasShortfall() {
        return shortfall.signum() > 0;
    }
}
