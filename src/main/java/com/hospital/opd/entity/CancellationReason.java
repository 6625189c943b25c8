package com.hospital.opd.entity;

public enum CancellationReason {
    PATIENT_REQUEST,
    DOCTOR_UNAVAILABLE,
    EMERGENCY,
    SYSTEM_ERROR,
    OTHER,
    PREEMPTED,
    MOVED,
    REALLOCATED
}
