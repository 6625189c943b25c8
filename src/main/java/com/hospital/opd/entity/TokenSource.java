package com.hospital.opd.entity;

import java.util.Locale;
import java.util.Optional;

public enum TokenSource {
    ONLINE,
    WALKIN,
    PRIORITY,
    FOLLOWUP,
    EMERGENCY;

    /**
     * Lenient lookup used by the priority calculator, which must report an
     * unknown source instead of throwing.
     */
    public static Optional<TokenSource> parse(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (TokenSource source : values()) {
            if (source.name().equals(normalized)) return Optional.of(source);
        }
        return Optional.empty();
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
