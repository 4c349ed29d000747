package com.warehouse.requisitions.dto;

import com.warehouse.requisitions.model.UserRole;
import lombok.Data;

// Only credential and role may change after creation; null fields are left untouched
@Data
public class UpdateUserRequest {
    private String password;
    private UserRole role;
}
