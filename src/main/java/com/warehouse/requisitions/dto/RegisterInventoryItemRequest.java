package com.warehouse.requisitions.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class RegisterInventoryItemRequest {
    @NotBlank
    @Size(max = 50)
    private String sku;

    @NotBlank
    private String description;

    @Size(max = 20)
    private String unit;

    @PositiveOrZero
    private BigDecimal initialStock;
}
