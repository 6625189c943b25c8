package com.hospital.opd.component;

import com.hospital.opd.entity.Slot;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import com.hospital.opd.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * A second writer commits between our read and our write; the stale write
 * must be retried against the fresh row.
 */
class VersionConflictRetryTest extends IntegrationTestSupport {

    @Autowired
    private ConcurrencyController concurrency;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate otherWriter;

    @BeforeEach
    void setUpWriter() {
        otherWriter = new TransactionTemplate(transactionManager);
        otherWriter.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Test
    void staleWriteIsRetriedOnce() {
        slot("S1", 5, 1);
        AtomicInteger attempts = new AtomicInteger();

        Slot updated = concurrency.updateWithOptimisticLock("slot-status:S1", slotRepository,
                () -> slotRepository.findBySlotId("S1").orElseThrow(),
                slot -> {
                    if (attempts.getAndIncrement() == 0) {
                        bumpReserveElsewhere();
                    }
                    slot.setStatus(Slot.Status.SUSPENDED);
                });

        assertThat(attempts).hasValue(2);
        assertThat(updated.getStatus()).isEqualTo(Slot.Status.SUSPENDED);
        Slot stored = reload("S1");
        assertThat(stored.getStatus()).isEqualTo(Slot.Status.SUSPENDED);
        assertThat(stored.getEmergencyReserved()).isEqualTo(2);
        assertThat(stored.getVersion()).isEqualTo(updated.getVersion());
    }

    @Test
    void persistentConflictSurfacesAsConcurrentModification() {
        slot("S1", 5, 0);
        AtomicInteger attempts = new AtomicInteger();

        AllocationException e = catchThrowableOfType(() -> concurrency.updateWithOptimisticLock("slot-status:S1",
                slotRepository,
                () -> slotRepository.findBySlotId("S1").orElseThrow(),
                slot -> {
                    attempts.incrementAndGet();
                    bumpReserveElsewhere();
                    slot.setStatus(Slot.Status.SUSPENDED);
                }), AllocationException.class);

        assertThat(e.getCode()).isEqualTo(ErrorCode.MAX_RETRIES_EXCEEDED);
        assertThat(e.getDetails()).containsEntry("errorType", TransientErrors.VERSION_CONFLICT);
        assertThat(ConcurrencyController.surface(e).getCode()).isEqualTo(ErrorCode.CONCURRENT_MODIFICATION);
        assertThat(attempts).hasValue(4);
        assertThat(reload("S1").getStatus()).isEqualTo(Slot.Status.ACTIVE);
    }

    private void bumpReserveElsewhere() {
        otherWriter.executeWithoutResult(status -> {
            Slot fresh = slotRepository.findBySlotId("S1").orElseThrow();
            fresh.setEmergencyReserved(fresh.getEmergencyReserved() + 1);
            slotRepository.saveAndFlush(fresh);
        });
    }
}
