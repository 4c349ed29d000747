package com.warehouse.requisitions.dto;

import com.warehouse.requisitions.model.RequisitionStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

// One row per requisition line, as exported to CSV and XLSX
@Data
@AllArgsConstructor
public class HistoryRow {
    private String code;
    private String requester;
    private String area;
    private String machine;
    private String sku;
    private String description;
    private BigDecimal qtyRequested;
    private BigDecimal qtyApproved;
    private RequisitionStatus status;
    private LocalDateTime createdAt;
}
