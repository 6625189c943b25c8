package com.hospital.opd.controller;

import com.hospital.opd.dto.ErrorResponse;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AllocationException.class)
    public ResponseEntity<ErrorResponse> handleAllocation(AllocationException e) {
        log.debug("Request failed with {}: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(e.getCode().getHttpStatus())
                .body(new ErrorResponse(e.getCode(), e.getCategory(), e.getMessage(), e.getDetails(),
                        e.getSuggestions()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        ErrorCode code = ErrorCode.VALIDATION_ERROR;
        return ResponseEntity.status(code.getHttpStatus())
                .body(new ErrorResponse(code, code.getCategory(), e.getMessage(), Map.of(),
                        List.of("Check the request body and parameters")));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        ErrorCode code = ErrorCode.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(code.getHttpStatus())
                .body(new ErrorResponse(code, code.getCategory(), code.getDefaultMessage(), Map.of(),
                        List.of("Try again later")));
    }
}
