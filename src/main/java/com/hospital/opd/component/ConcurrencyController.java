package com.hospital.opd.component;

import com.hospital.opd.config.OpdProperties;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * Runs store work with bounded retry on transient failures and, where asked,
 * inside one all-or-nothing transaction. Also fronts the in-flight registry.
 */
@Component
public class ConcurrencyController {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyController.class);

    private final TransactionTemplate transactionTemplate;
    private final OperationRegistry operationRegistry;
    private final OpdProperties.Retry retryProperties;
    private final OpdProperties.Allocation allocationProperties;
    private final Clock clock;

    public ConcurrencyController(TransactionTemplate allocationTransactionTemplate,
                                 OperationRegistry operationRegistry,
                                 OpdProperties properties,
                                 Clock clock) {
        this.transactionTemplate = allocationTransactionTemplate;
        this.operationRegistry = operationRegistry;
        this.retryProperties = properties.getRetry();
        this.allocationProperties = properties.getAllocation();
        this.clock = clock;
    }

    public OperationGuard acquire(String operationKey) {
        return operationRegistry.acquire(operationKey);
    }

    public List<OperationRegistry.InFlightOperation> inFlightOperations() {
        return operationRegistry.snapshot();
    }

    public Deadline newDeadline() {
        return Deadline.after(allocationProperties.getOperationDeadline(), clock);
    }

    public <T> T executeWithRetry(String context, IntFunction<T> operation) {
        return executeWithRetry(context, retryProperties.getMaxRetries(), operation);
    }

    /**
     * Invokes {@code operation(attempt)} until it succeeds, fails permanently or
     * {@code maxRetries} retries are spent. Exhaustion surfaces as
     * {@code MAX_RETRIES_EXCEEDED} with the last error type in the details.
     */
    public <T> T executeWithRetry(String context, int maxRetries, IntFunction<T> operation) {
        AtomicInteger attempt = new AtomicInteger();
        Retry retry = Retry.of(context, retryConfig(maxRetries));
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Retrying {} (attempt {}/{}) in {} ms: {}",
                context, event.getNumberOfRetryAttempts(), maxRetries,
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        try {
            T result = retry.executeSupplier(() -> operation.apply(attempt.getAndIncrement()));
            if (attempt.get() > 1) {
                log.info("{} succeeded after {} retries", context, attempt.get() - 1);
            }
            return result;
        } catch (RuntimeException e) {
            if (!TransientErrors.isTransient(e)) {
                throw e;
            }
            String errorType = TransientErrors.errorType(e);
            log.error("{} failed after {} attempts ({}): {}", context, attempt.get(), errorType, e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("context", context);
            details.put("maxRetries", maxRetries);
            details.put("errorType", errorType);
            throw new AllocationException(ErrorCode.MAX_RETRIES_EXCEEDED,
                    "Operation failed after " + attempt.get() + " attempts",
                    details, List.of("Retry the request later"), e);
        }
    }

    /**
     * Runs {@code operation} in a fresh transaction per attempt. The deadline is
     * checked before each attempt.
     */
    public <T> T executeTransaction(String context, Deadline deadline, IntFunction<T> operation) {
        return executeWithRetry(context, attempt -> {
            deadline.check(context);
            return transactionTemplate.execute(status -> operation.apply(attempt));
        });
    }

    /**
     * Loads an entity, applies {@code mutateFn} and flushes with the version
     * check; a concurrent writer causes a reload and another attempt.
     */
    public <E> E updateWithOptimisticLock(String context, JpaRepository<E, ?> repository,
                                          Supplier<E> loader, Consumer<E> mutateFn) {
        return executeTransaction(context, newDeadline(), attempt -> {
            E entity = loader.get();
            mutateFn.accept(entity);
            return repository.saveAndFlush(entity);
        });
    }

    /**
     * Maps an exhausted retry to the code public operations report:
     * conflicts as {@code CONCURRENT_MODIFICATION}, system faults as
     * {@code SERVICE_UNAVAILABLE}. Other exceptions are returned unchanged.
     */
    public static AllocationException surface(AllocationException e) {
        if (e.getCode() != ErrorCode.MAX_RETRIES_EXCEEDED) {
            return e;
        }
        Object errorType = e.getDetails().get("errorType");
        ErrorCode code = TransientErrors.isConflict(String.valueOf(errorType))
                ? ErrorCode.CONCURRENT_MODIFICATION
                : ErrorCode.SERVICE_UNAVAILABLE;
        return new AllocationException(code, code.getDefaultMessage(), e.getDetails(),
                List.of("Retry the request"), e);
    }

    long backoffMillis(int retryNumber) {
        double raw = retryProperties.getBaseDelay().toMillis()
                * Math.pow(retryProperties.getBackoffFactor(), Math.max(0, retryNumber - 1));
        double capped = Math.min(raw, retryProperties.getMaxDelay().toMillis());
        if (retryProperties.isJitter()) {
            capped *= 0.5 + ThreadLocalRandom.current().nextDouble() * 0.5;
        }
        return Math.max(1L, Math.round(capped));
    }

    private RetryConfig retryConfig(int maxRetries) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, maxRetries + 1))
                .intervalFunction(this::backoffMillis)
                .retryOnException(TransientErrors::isTransient)
                .build();
    }
}
