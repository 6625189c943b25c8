package com.hospital.opd.dto;

import com.hospital.opd.exception.ErrorCategory;
import com.hospital.opd.exception.ErrorCode;

import java.util.List;
import java.util.Map;

public record ErrorResponse(ErrorCode errorCode, ErrorCategory category, String message,
                            Map<String, Object> details, List<String> suggestions) {
}
