package com.warehouse.requisitions.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum ErrorCode {
    // Validation: rejected before anything is written
    INVALID_INPUT(HttpStatus.BAD_REQUEST, false, "Invalid input"),
    EMPTY_REQUISITION(HttpStatus.BAD_REQUEST, false, "A requisition needs at least one item with a positive quantity"),
    UNKNOWN_INVENTORY_ITEM(HttpStatus.BAD_REQUEST, false, "Inventory item not found"),
    INVALID_APPROVED_QUANTITY(HttpStatus.BAD_REQUEST, false, "Approved quantity out of range"),
    UNKNOWN_USER(HttpStatus.BAD_REQUEST, false, "User not found"),
    UNKNOWN_REFERENCE(HttpStatus.BAD_REQUEST, false, "Machine or area not found"),
    MACHINE_AREA_MISMATCH(HttpStatus.BAD_REQUEST, false, "Machine does not belong to the given area"),
    DUPLICATE_REFERENCE(HttpStatus.BAD_REQUEST, false, "Code already in use"),

    REQUISITION_NOT_FOUND(HttpStatus.NOT_FOUND, false, "Requisition not found"),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN, false, "Role not allowed to perform this action"),

    // State conflict: the caller must re-fetch before deciding again
    INVALID_STATE_TRANSITION(HttpStatus.CONFLICT, false, "Requisition is no longer pending"),

    // Retryable
    CODE_GENERATION_FAILED(HttpStatus.SERVICE_UNAVAILABLE, true, "Could not allocate a requisition code"),
    STORAGE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, true, "Storage unavailable, please retry");

    private final HttpStatus status;
    private final boolean retryable;
    private final String defaultMessage;
}
