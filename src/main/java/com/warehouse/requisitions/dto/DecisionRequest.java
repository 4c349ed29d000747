package com.warehouse.requisitions.dto;

import com.warehouse.requisitions.model.Decision;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

@Data
public class DecisionRequest {
    @NotNull
    private Decision decision;

    // RequisitionItem id -> approved quantity; absent items are approved at 0
    private Map<Long, BigDecimal> approvedQuantities = new HashMap<>();

    @Size(max = 2000)
    private String comment;
}
