package com.warehouse.requisitions.exception;

import lombok.Getter;

/**
 * Base type of every failure the requisition core reports to its callers.
 */
@Getter
public abstract class RequisitionException extends RuntimeException {
    private final ErrorCode errorCode;

    protected RequisitionException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected RequisitionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
}
