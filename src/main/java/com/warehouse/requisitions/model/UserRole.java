package com.warehouse.requisitions.model;

public enum UserRole {
    REQUESTER,
    APPROVER,
    ADMINISTRATOR;

    public boolean canSubmit() {
        return switch (this) {
            case REQUESTER, ADMINISTRATOR -> true;
            case APPROVER -> false;
        };
    }

    public boolean canDecide() {
        return switch (this) {
            case APPROVER, ADMINISTRATOR -> true;
            case REQUESTER -> false;
        };
    }
}
