package com.warehouse.requisitions.exception;

import java.math.BigDecimal;

public class ValidationException extends RequisitionException {

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static ValidationException emptyRequisition() {
        return new ValidationException(ErrorCode.EMPTY_REQUISITION, ErrorCode.EMPTY_REQUISITION.getDefaultMessage());
    }

    public static ValidationException unknownInventoryItem(Long itemId) {
        return new ValidationException(ErrorCode.UNKNOWN_INVENTORY_ITEM, "Inventory item not found: " + itemId);
    }

    public static ValidationException invalidApprovedQuantity(Long requisitionItemId, BigDecimal qty, BigDecimal requested) {
        return new ValidationException(ErrorCode.INVALID_APPROVED_QUANTITY,
                "Approved quantity " + qty + " for item " + requisitionItemId + " must be between 0 and " + requested);
    }

    public static ValidationException unsupportedQuantity(ErrorCode errorCode, String subject, BigDecimal qty) {
        return new ValidationException(errorCode, subject + " " + qty.toPlainString()
                + " has more than 11 integer digits or 3 decimals");
    }

    public static ValidationException unknownUser(Long userId) {
        return new ValidationException(ErrorCode.UNKNOWN_USER, "User not found: " + userId);
    }

    public static ValidationException unknownReference(String kind, Long id) {
        return new ValidationException(ErrorCode.UNKNOWN_REFERENCE, kind + " not found: " + id);
    }
}
