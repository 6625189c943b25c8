package com.hospital.opd.service;

public enum PriorityLevel {
    EMERGENCY,
    HIGH,
    MEDIUM,
    LOW;

    public static PriorityLevel of(int score) {
        if (score >= 1000) return EMERGENCY;
        if (score >= 700) return HIGH;
        if (score >= 400) return MEDIUM;
        return LOW;
    }
}
