package com.warehouse.requisitions.exception;

import com.warehouse.requisitions.model.UserRole;

public class PermissionDeniedException extends RequisitionException {
    public PermissionDeniedException(String username, UserRole role, String action) {
        super(ErrorCode.PERMISSION_DENIED, "User " + username + " (" + role + ") may not " + action);
    }
}
