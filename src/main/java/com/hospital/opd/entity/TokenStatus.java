package com.hospital.opd.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Token lifecycle. A token is counted against its slot's capacity only while
 * it is {@link #isActive() active}.
 */
public enum TokenStatus {
    ALLOCATED,
    CONFIRMED,
    IN_CONSULTATION,
    COMPLETED,
    CANCELLED,
    NOSHOW;

    public static final Set<TokenStatus> ACTIVE = EnumSet.of(ALLOCATED, CONFIRMED, IN_CONSULTATION);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == NOSHOW;
    }

    /** Tokens a higher-priority arrival may still displace. */
    public boolean isPreemptable() {
        return this == ALLOCATED || this == CONFIRMED;
    }
}
