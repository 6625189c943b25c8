package com.hospital.opd.service;

import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.exception.ErrorCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a priority calculation. A failed result carries an error code
 * instead of a score.
 */
public record PriorityResult(
        boolean success,
        TokenSource source,
        int basePriority,
        int finalPriority,
        PriorityLevel priorityLevel,
        Map<String, Integer> breakdown,
        ErrorCode errorCode,
        String message
) {

    public static PriorityResult success(TokenSource source, int base, int finalPriority, Map<String, Integer> breakdown) {
        return new PriorityResult(true, source, base, finalPriority, PriorityLevel.of(finalPriority),
                Collections.unmodifiableMap(new LinkedHashMap<>(breakdown)), null, null);
    }

    public static PriorityResult invalidSource(String source) {
        return new PriorityResult(false, null, 0, 0, null, Map.of(), ErrorCode.VALIDATION_ERROR,
                "Invalid token source: " + source + ". Must be one of: online, walkin, priority, followup, emergency");
    }
}
