package com.warehouse.requisitions.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SubmitRequisitionRequest {
    private Long machineId;
    private Long areaId;

    @NotNull
    private List<RequestedItem> items = new ArrayList<>();

    @Size(max = 2000)
    private String note;
}
