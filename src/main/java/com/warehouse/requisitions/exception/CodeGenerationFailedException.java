package com.warehouse.requisitions.exception;

public class CodeGenerationFailedException extends RequisitionException {
    public CodeGenerationFailedException(String message) {
        super(ErrorCode.CODE_GENERATION_FAILED, message);
    }

    public CodeGenerationFailedException(String message, Throwable cause) {
        super(ErrorCode.CODE_GENERATION_FAILED, message, cause);
    }
}
