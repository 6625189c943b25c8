package com.hospital.opd.component;

import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Soft deadline of one request. Checked before each store attempt; work that
 * already committed stays committed.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock, clock.instant().plus(timeout));
    }

    public static Deadline none(Clock clock) {
        return new Deadline(clock, Instant.MAX);
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    public void check(String context) {
        if (isExpired()) {
            throw new AllocationException(ErrorCode.SERVICE_UNAVAILABLE,
                    "Operation deadline exceeded",
                    Map.of("context", context, "deadline", expiresAt.toString()),
                    List.of("Try again later"));
        }
    }
}
