package com.hospital.opd.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Static defaults bound from {@code opd.*}. Runtime overrides for the tunable
 * keys live in the {@code configurations} table, see {@link ConfigKey}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "opd")
public class OpdProperties {

    private Priority priority = new Priority();
    private Capacity capacity = new Capacity();
    private Timing timing = new Timing();
    private Allocation allocation = new Allocation();
    private Retry retry = new Retry();
    private InFlight inFlight = new InFlight();
    private Config config = new Config();

    @Getter
    @Setter
    public static class Priority {
        private int emergency = 1000;
        private int priority = 800;
        private int followup = 600;
        private int online = 400;
        private int walkin = 200;
    }

    @Getter
    @Setter
    public static class Capacity {
        private int defaultSlotCapacity = 10;
        private int emergencyReservePercentage = 20;
    }

    @Getter
    @Setter
    public static class Timing {
        private int defaultConsultationMinutes = 15;
        private int bufferMinutes = 5;
        private int reallocationWindowHours = 4;
    }

    @Getter
    @Setter
    public static class Allocation {
        private int preemptionThreshold = 200;
        private int reallocationSearchLimit = 5;
        private List<String> reallocationOrder = new ArrayList<>(List.of(
                "same_doctor_same_day", "same_specialty_same_day", "same_doctor_next_day"));
        private Duration operationDeadline = Duration.ofSeconds(30);
        private int maxAlternatives = 5;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 1;
        private Duration baseDelay = Duration.ofMillis(50);
        private double backoffFactor = 1.5;
        private Duration maxDelay = Duration.ofMillis(200);
        private boolean jitter = true;
    }

    @Getter
    @Setter
    public static class InFlight {
        private Duration staleAfter = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Config {
        private Duration cacheTtl = Duration.ofMinutes(5);
    }
}
