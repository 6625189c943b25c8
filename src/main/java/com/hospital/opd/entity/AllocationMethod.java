package com.hospital.opd.entity;

public enum AllocationMethod {
    DIRECT,
    PREEMPTION,
    REALLOCATION
}
