package com.warehouse.requisitions.dto;

import com.warehouse.requisitions.model.User;
import com.warehouse.requisitions.model.UserRole;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class UserView {
    private Long id;
    private String username;
    private String fullName;
    private UserRole role;

    public static UserView from(User user) {
        return new UserView(user.getId(), user.getUsername(), user.getFullName(), user.getRole());
    }
}
