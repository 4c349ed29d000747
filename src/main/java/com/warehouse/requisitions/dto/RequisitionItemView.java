package com.warehouse.requisitions.dto;

import com.warehouse.requisitions.model.InventoryItem;
import com.warehouse.requisitions.model.RequisitionItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RequisitionItemView {
    Long id;
    Integer lineNumber;
    Long inventoryItemId;
    String sku;
    String description;
    String unit;
    BigDecimal qtyRequested;
    BigDecimal qtyApproved;
    BigDecimal shortfall;

    public static RequisitionItemView from(RequisitionItem item) {
        InventoryItem inventoryItem = item.getInventoryItem();
        return RequisitionItemView.builder()
                .id(item.getId())
                .lineNumber(item.getLineNumber())
                .inventoryItemId(inventoryItem.getId())
                .sku(inventoryItem.getSku())
                .description(inventoryItem.getDescription())
                .unit(inventoryItem.getUnit())
                .qtyRequested(item.getQtyRequested())
                .qtyApproved(item.getQtyApproved())
                .shortfall(item.getShortfall())
                .build();
    }
}
