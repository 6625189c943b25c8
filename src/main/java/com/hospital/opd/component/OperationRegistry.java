package com.hospital.opd.component;

import com.hospital.opd.config.OpdProperties;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local set of operations currently in flight, keyed like
 * {@code allocate:{slotId}:{patientId}}. A second request with the same key is
 * refused until the first one finishes. The mutex is never held across I/O.
 */
@Component
public class OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private final Map<String, Instant> operations = new HashMap<>();
    private final ReentrantLock mutex = new ReentrantLock();
    private final Clock clock;
    private final Duration staleAfter;

    public OperationRegistry(Clock clock, OpdProperties properties) {
        this.clock = clock;
        this.staleAfter = properties.getInFlight().getStaleAfter();
    }

    public static String allocateKey(String slotId, String patientId) {
        return "allocate:" + slotId + ":" + patientId;
    }

    public static String tokenKey(String operation, String tokenId) {
        return operation + ":" + tokenId;
    }

    /**
     * Registers {@code key} or fails with {@code OPERATION_IN_PROGRESS}.
     * The returned guard removes the key when closed.
     */
    public OperationGuard acquire(String key) {
        mutex.lock();
        try {
            Instant started = operations.get(key);
            if (started != null) {
                throw new AllocationException(ErrorCode.OPERATION_IN_PROGRESS,
                        "A similar operation is already in progress",
                        Map.of("operationKey", key, "startedAt", started.toString()),
                        List.of("Wait for the running request to finish", "Retry shortly"));
            }
            operations.put(key, clock.instant());
        } finally {
            mutex.unlock();
        }
        return new OperationGuard(this, key);
    }

    void release(String key) {
        mutex.lock();
        try {
            operations.remove(key);
        } finally {
            mutex.unlock();
        }
    }

    public boolean isInFlight(String key) {
        mutex.lock();
        try {
            return operations.containsKey(key);
        } finally {
            mutex.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${opd.in-flight.sweep-interval:PT1M}",
               initialDelayString = "${opd.in-flight.sweep-interval:PT1M}")
    public void sweepScheduled() {
        sweep();
    }

    /** Evicts keys older than the staleness limit; returns how many were dropped. */
    public int sweep() {
        Instant now = clock.instant();
        List<String> evicted = new ArrayList<>();
        mutex.lock();
        try {
            Iterator<Map.Entry<String, Instant>> it = operations.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Instant> entry = it.next();
                if (Duration.between(entry.getValue(), now).compareTo(staleAfter) > 0) {
                    evicted.add(entry.getKey());
                    it.remove();
                }
            }
        } finally {
            mutex.unlock();
        }
        for (String key : evicted) {
            log.warn("Cleaned up stale operation: {} (maxAge={})", key, staleAfter);
        }
        return evicted.size();
    }

    public List<InFlightOperation> snapshot() {
        Instant now = clock.instant();
        List<InFlightOperation> result = new ArrayList<>();
        mutex.lock();
        try {
            operations.forEach((key, started) ->
                    result.add(new InFlightOperation(key, started, Duration.between(started, now).toMillis())));
        } finally {
            mutex.unlock();
        }
        result.sort(Comparator.comparing(InFlightOperation::startedAt));
        return result;
    }

    public record InFlightOperation(String operationKey, Instant startedAt, long ageMillis) {
    }
}
