package com.hospital.opd.dto;

public enum UrgencyLevel {
    ROUTINE(0),
    MODERATE(0),
    HIGH(75),
    CRITICAL(150);

    private final int modifier;

    UrgencyLevel(int modifier) {
        this.modifier = modifier;
    }

    public int modifier() {
        return modifier;
    }
}
