package com.warehouse.requisitions.exception;

import com.warehouse.requisitions.model.RequisitionStatus;
import lombok.Getter;

@Getter
public class InvalidStateTransitionException extends RequisitionException {
    private final String requisitionCode;
    private final RequisitionStatus currentStatus;

    public InvalidStateTransitionException(String requisitionCode, RequisitionStatus currentStatus) {
        super(ErrorCode.INVALID_STATE_TRANSITION,
                "Requisition " + requisitionCode + " is " + currentStatus + " and can no longer be decided");
        this.requisitionCode = requisitionCode;
        this.currentStatus = currentStatus;
    }
}
