package com.hospital.opd.config;

import java.util.Arrays;
import java.util.Optional;

/**
 * Tunables that may be overridden at runtime, with their validation bounds.
 */
public enum ConfigKey {
    PRIORITY_EMERGENCY("priority.emergency", "priority", "Base priority for emergency tokens", 0, 2000),
    PRIORITY_PRIORITY("priority.priority", "priority", "Base priority for priority patients", 0, 2000),
    PRIORITY_FOLLOWUP("priority.followup", "priority", "Base priority for follow-up visits", 0, 2000),
    PRIORITY_ONLINE("priority.online", "priority", "Base priority for online bookings", 0, 2000),
    PRIORITY_WALKIN("priority.walkin", "priority", "Base priority for walk-in patients", 0, 2000),
    DEFAULT_SLOT_CAPACITY("capacity.default_slot_capacity", "capacity", "Capacity of a slot opened without one", 1, 50),
    EMERGENCY_RESERVE_PERCENTAGE("capacity.emergency_reserve_percentage", "capacity", "Share of a new slot closed to non-emergency sources", 0, 100),
    DEFAULT_CONSULTATION_MINUTES("timing.default_consultation_minutes", "timing", "Expected consultation length", 1, 120),
    BUFFER_MINUTES("timing.buffer_minutes", "timing", "Gap between consultations", 0, 60),
    REALLOCATION_WINDOW_HOURS("timing.reallocation_window_hours", "timing", "Same-day window searched for a displaced token", 0, 24),
    PREEMPTION_THRESHOLD("allocation.preemption_threshold", "allocation", "Priority lead needed by non-emergency preemption", 0, 2000),
    REALLOCATION_SEARCH_LIMIT("allocation.reallocation_search_limit", "allocation", "Candidate slots examined per displaced token", 1, 50),
    REALLOCATION_ORDER("allocation.reallocation_order", "allocation", "Comma separated reallocation scopes", null, null);

    private final String key;
    private final String category;
    private final String description;
    private final Integer min;
    private final Integer max;

    ConfigKey(String key, String category, String description, Integer min, Integer max) {
        this.key = key;
        this.category = category;
        this.description = description;
        this.min = min;
        this.max = max;
    }

    public String key() {
        return key;
    }

    public String category() {
        return category;
    }

    public String description() {
        return description;
    }

    public boolean isNumeric() {
        return min != null;
    }

    public Integer min() {
        return min;
    }

    public Integer max() {
        return max;
    }

    public static Optional<ConfigKey> fromKey(String key) {
        return Arrays.stream(values()).filter(k -> k.key.equals(key)).findFirst();
    }
}
