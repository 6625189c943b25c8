package com.hospital.opd.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    VALIDATION_ERROR(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, "Input validation failed"),

    SLOT_CAPACITY_EXCEEDED(ErrorCategory.BUSINESS_LOGIC, HttpStatus.CONFLICT, "The requested time slot has reached maximum capacity"),
    SLOT_NOT_AVAILABLE(ErrorCategory.BUSINESS_LOGIC, HttpStatus.CONFLICT, "The requested time slot is not available"),
    SLOT_NOT_FOUND(ErrorCategory.BUSINESS_LOGIC, HttpStatus.NOT_FOUND, "Time slot not found"),
    TOKEN_NOT_FOUND(ErrorCategory.BUSINESS_LOGIC, HttpStatus.NOT_FOUND, "Token not found"),
    TOKEN_ALREADY_PROCESSED(ErrorCategory.BUSINESS_LOGIC, HttpStatus.CONFLICT, "Token has already been processed"),
    INVALID_TOKEN_STATUS(ErrorCategory.BUSINESS_LOGIC, HttpStatus.CONFLICT, "Invalid token status for this operation"),
    SCHEDULING_CONFLICT(ErrorCategory.BUSINESS_LOGIC, HttpStatus.CONFLICT, "Scheduling conflict detected"),

    CONCURRENT_MODIFICATION(ErrorCategory.CONCURRENCY, HttpStatus.CONFLICT, "Resource was modified by another operation"),
    OPERATION_IN_PROGRESS(ErrorCategory.CONCURRENCY, HttpStatus.CONFLICT, "A similar operation is already in progress"),
    MAX_RETRIES_EXCEEDED(ErrorCategory.CONCURRENCY, HttpStatus.CONFLICT, "Operation failed after exhausting retries"),

    SERVICE_UNAVAILABLE(ErrorCategory.SYSTEM, HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),
    INTERNAL_SERVER_ERROR(ErrorCategory.SYSTEM, HttpStatus.INTERNAL_SERVER_ERROR, "An internal server error occurred");

    private final ErrorCategory category;
    private final HttpStatus httpStatus;
    private final String defaultMessage;

    ErrorCode(ErrorCategory category, HttpStatus httpStatus, String defaultMessage) {
        this.category = category;
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
