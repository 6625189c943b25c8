package com.hospital.opd.exception;

public enum ErrorCategory {
    VALIDATION,
    BUSINESS_LOGIC,
    CONCURRENCY,
    SYSTEM,
    EXTERNAL
}
