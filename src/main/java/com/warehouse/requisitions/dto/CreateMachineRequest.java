package com.warehouse.requisitions.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateMachineRequest {
    @NotBlank
    @Size(max = 50)
    private String code;

    @NotBlank
    private String name;

    private Long areaId;
}
