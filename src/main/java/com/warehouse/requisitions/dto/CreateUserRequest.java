package com.warehouse.requisitions.dto;

import com.warehouse.requisitions.model.UserRole;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateUserRequest {
    @NotBlank
    @Size(max = 100)
    private String username;

    private String fullName;

    @NotBlank
    @Size(min = 4)
    private String password;

    @NotNull
    private UserRole role;
}
