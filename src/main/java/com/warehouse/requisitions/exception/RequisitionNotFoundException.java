package com.warehouse.requisitions.exception;

public class RequisitionNotFoundException extends RequisitionException {
    public RequisitionNotFoundException(Long requisitionId) {
        super(ErrorCode.REQUISITION_NOT_FOUND, "Requisition not found: " + requisitionId);
    }
}
