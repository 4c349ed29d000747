package com.warehouse.requisitions.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
public class ApiError {
    private String code;
    private String message;
    private boolean retryable;
    private LocalDateTime timestamp;

    public static ApiError of(String code, String message, boolean retryable) {
        return new ApiError(code, message, retryable, LocalDateTime.now());
    }
}
