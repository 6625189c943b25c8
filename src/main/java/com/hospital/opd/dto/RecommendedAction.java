package com.hospital.opd.dto;

public enum RecommendedAction {
    SAME_DEPARTMENT_TODAY,
    SAME_DOCTOR_FUTURE,
    NEXT_AVAILABLE,
    NO_ALTERNATIVES
}
