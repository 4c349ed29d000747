package com.warehouse.requisitions.dto;

import com.warehouse.requisitions.model.RequisitionStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
public class RequisitionKpis {
    private long totalRequisitions;
    private Map<RequisitionStatus, Long> countByStatus;
    private Double averageHoursToDecision; // null until something has been decided
    private List<TopItem> topRequestedItems;

    @Data
    @AllArgsConstructor
    public static class TopItem {
        private String sku;
        private String description;
        private BigDecimal totalRequested;
    }
}
