package com.warehouse.requisitions.config;

import com.warehouse.requisitions.dto.ApiError;
import com.warehouse.requisitions.exception.ErrorCode;
import com.warehouse.requisitions.exception.RequisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RequisitionException.class)
    public ResponseEntity<ApiError> handleRequisitionException(RequisitionException ex) {
        ErrorCode code = ex.getErrorCode();
        if (code.isRetryable()) {
            logger.warn("{}: {}", code, ex.getMessage(), ex);
        } else {
            logger.info("{}: {}", code, ex.getMessage());
        }
        return respond(code, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return respond(ErrorCode.INVALID_INPUT, message.isEmpty() ? ErrorCode.INVALID_INPUT.getDefaultMessage() : message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleUnreadableRequest(Exception ex) {
        logger.info("Malformed request: {}", ex.getMessage());
        return respond(ErrorCode.INVALID_INPUT, ErrorCode.INVALID_INPUT.getDefaultMessage());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiError> handleAccessDenied(AccessDeniedException ex) {
        return respond(ErrorCode.PERMISSION_DENIED, ErrorCode.PERMISSION_DENIED.getDefaultMessage());
    }

    // Lock timeouts, optimistic lock failures and lost connections
    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ApiError> handleStorageFailure(Exception ex) {
        logger.warn("Storage failure: {}", ex.getMessage(), ex);
        return respond(ErrorCode.STORAGE_FAILURE, ErrorCode.STORAGE_FAILURE.getDefaultMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleException(Exception ex) {
        logger.error("Unexpected error", ex);
        return ResponseEntity.internalServerError()
                .body(ApiError.of("INTERNAL_ERROR", "Unexpected error", false));
    }

    private ResponseEntity<ApiError> respond(ErrorCode code, String message) {
        return ResponseEntity.status(code.getStatus())
                .body(ApiError.of(code.name(), message, code.isRetryable()));
    }
}
