package com.hospital.opd.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Failure raised by the allocation core. Carries a stable code, a details map
 * for the caller and zero or more suggested next actions.
 */
public class AllocationException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;
    private final List<String> suggestions;

    public AllocationException(ErrorCode code, String message) {
        this(code, message, Map.of(), List.of(), null);
    }

    public AllocationException(ErrorCode code, String message, Map<String, Object> details) {
        this(code, message, details, List.of(), null);
    }

    public AllocationException(ErrorCode code, String message, Map<String, Object> details, List<String> suggestions) {
        this(code, message, details, suggestions, null);
    }

    public AllocationException(ErrorCode code, String message, Map<String, Object> details,
                               List<String> suggestions, Throwable cause) {
        super(message != null ? message : code.getDefaultMessage(), cause);
        this.code = code;
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public static AllocationException slotNotFound(String slotId) {
        return new AllocationException(ErrorCode.SLOT_NOT_FOUND, "Slot " + slotId + " not found",
                Map.of("slotId", String.valueOf(slotId)), List.of("Check the slot id"));
    }

    public static AllocationException tokenNotFound(String tokenId) {
        return new AllocationException(ErrorCode.TOKEN_NOT_FOUND, "Token " + tokenId + " not found",
                Map.of("tokenId", String.valueOf(tokenId)), List.of("Check the token id"));
    }

    public static AllocationException validation(String message, Map<String, Object> details) {
        return new AllocationException(ErrorCode.VALIDATION_ERROR, message, details,
                List.of("Check required parameters"));
    }
}
