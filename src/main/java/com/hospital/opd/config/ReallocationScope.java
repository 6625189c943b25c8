package com.hospital.opd.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Where a displaced token is looked for, in the order configured by
 * {@code allocation.reallocation_order}.
 */
public enum ReallocationScope {
    SAME_DOCTOR_SAME_DAY,
    SAME_SPECIALTY_SAME_DAY,
    SAME_DOCTOR_NEXT_DAY;

    public static Optional<ReallocationScope> parse(String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
