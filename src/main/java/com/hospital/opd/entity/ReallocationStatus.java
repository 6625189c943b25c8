package com.hospital.opd.entity;

public enum ReallocationStatus {
    REALLOCATED,
    PENDING_REALLOCATION
}
