package com.warehouse.requisitions.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RequestedItem {
    private Long inventoryItemId;
    private BigDecimal qty;
}
