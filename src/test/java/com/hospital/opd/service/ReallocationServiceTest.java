package com.hospital.opd.service;

import com.hospital.opd.dto.BatchReallocationRequest;
import com.hospital.opd.dto.BatchReallocationResult;
import com.hospital.opd.dto.PreemptedToken;
import com.hospital.opd.entity.AllocationMethod;
import com.hospital.opd.entity.CancellationReason;
import com.hospital.opd.entity.ReallocationStatus;
import com.hospital.opd.entity.Slot;
import com.hospital.opd.entity.Token;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.entity.TokenStatus;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import com.hospital.opd.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ReallocationServiceTest extends IntegrationTestSupport {

    @Autowired
    private ReallocationService reallocationService;

    @Test
    void suspendedSlotIsEmptiedHighestPriorityFirst() {
        slot("S1", 4, 0);
        slot("S2", "DOC-1", "cardiology", TODAY, "10:00", 2, 0);
        slot("S3", "DOC-1", "cardiology", TODAY, "11:00", 1, 0);
        slot("S4", "DOC-1", "cardiology", TODAY, "12:00", 1, 0);
        Token walkin = existingToken("S1", "P-W", TokenSource.WALKIN, 200, TokenStatus.ALLOCATED);
        Token online = existingToken("S1", "P-O", TokenSource.ONLINE, 400, TokenStatus.CONFIRMED);
        Token priority = existingToken("S1", "P-P", TokenSource.PRIORITY, 800, TokenStatus.ALLOCATED);
        Token followup = existingToken("S1", "P-F", TokenSource.FOLLOWUP, 600, TokenStatus.ALLOCATED);
        suspend("S1");

        BatchReallocationResult result = reallocationService.reallocateBatch(BatchReallocationRequest.builder()
                .slotId("S1").reason("doctor called away").build());

        assertThat(result.failed()).isEmpty();
        assertThat(result.relocated())
                .extracting(BatchReallocationResult.Relocated::originalTokenId,
                        BatchReallocationResult.Relocated::toSlotId)
                .containsExactly(
                        tuple(priority.getTokenId(), "S2"),
                        tuple(followup.getTokenId(), "S2"),
                        tuple(online.getTokenId(), "S3"),
                        tuple(walkin.getTokenId(), "S4"));

        for (BatchReallocationResult.Relocated moved : result.relocated()) {
            Token original = reloadToken(moved.originalTokenId());
            Token copy = reloadToken(moved.newTokenId());
            assertThat(original.getStatus()).isEqualTo(TokenStatus.CANCELLED);
            assertThat(original.getMetadata().getCancellationReason()).isEqualTo(CancellationReason.REALLOCATED);
            assertThat(copy.getPatientId()).isEqualTo(original.getPatientId());
            assertThat(copy.getPriority()).isEqualTo(original.getPriority());
            assertThat(copy.getSource()).isEqualTo(original.getSource());
            assertThat(copy.getMetadata().getAllocationMethod()).isEqualTo(AllocationMethod.REALLOCATION);
        }
        assertThat(reloadToken(result.relocated().get(2).newTokenId()).getStatus()).isEqualTo(TokenStatus.CONFIRMED);
        assertThat(reload("S1").getCurrentAllocation()).isZero();
        for (String slotId : List.of("S1", "S2", "S3", "S4")) {
            assertSlotInvariants(slotId);
        }
    }

    @Test
    void tokensWithoutRoomAreMarkedPending() {
        slot("S1", 2, 0);
        slot("S2", "DOC-1", "cardiology", TODAY, "10:00", 1, 0);
        Token high = existingToken("S1", "P-H", TokenSource.PRIORITY, 800, TokenStatus.ALLOCATED);
        Token low = existingToken("S1", "P-L", TokenSource.WALKIN, 200, TokenStatus.ALLOCATED);
        suspend("S1");

        BatchReallocationResult result = reallocationService.reallocateBatch(BatchReallocationRequest.builder()
                .slotId("S1").build());

        assertThat(result.relocated()).extracting(BatchReallocationResult.Relocated::originalTokenId)
                .containsExactly(high.getTokenId());
        assertThat(result.failed()).singleElement().satisfies(f -> {
            assertThat(f.tokenId()).isEqualTo(low.getTokenId());
            assertThat(f.errorCode()).isEqualTo(ErrorCode.SLOT_NOT_AVAILABLE);
        });
        Token pending = reloadToken(low.getTokenId());
        assertThat(pending.getStatus()).isEqualTo(TokenStatus.ALLOCATED);
        assertThat(pending.getMetadata().getReallocationStatus()).isEqualTo(ReallocationStatus.PENDING_REALLOCATION);
        assertThat(reload("S1").getCurrentAllocation()).isEqualTo(1);
        assertSlotInvariants("S1");
        assertSlotInvariants("S2");
    }

    @Test
    void searchFollowsConfiguredOrder() {
        configurationService.setValue("allocation.reallocation_order", "same_specialty_same_day", "admin");
        slot("S1", 1, 0);
        slot("S-OTHER-DOC", "DOC-2", "cardiology", TODAY, "14:00", 1, 0);
        slot("S-NEXT-DAY", "DOC-1", "cardiology", TODAY.plusDays(1), "09:00", 1, 0);
        existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);
        suspend("S1");

        BatchReallocationResult result = reallocationService.reallocateBatch(BatchReallocationRequest.builder()
                .slotId("S1").build());

        assertThat(result.relocated()).singleElement()
                .extracting(BatchReallocationResult.Relocated::toSlotId).isEqualTo("S-OTHER-DOC");
    }

    @Test
    void sameDoctorWindowLimitsSameDayCandidates() {
        configurationService.setValue("allocation.reallocation_order",
                "same_doctor_same_day,same_doctor_next_day", "admin");
        slot("S1", 1, 0);
        slot("S-NEAR", "DOC-1", "cardiology", TODAY, "12:00", 1, 0);
        slot("S-LATE", "DOC-1", "cardiology", TODAY, "15:00", 1, 0);
        slot("S-TOMORROW", "DOC-1", "cardiology", TODAY.plusDays(1), "09:00", 1, 0);

        assertThat(reallocationService.candidateSlots(reload("S1"), configurationService.snapshot(), false))
                .extracting(Slot::getSlotId)
                .containsExactly("S-NEAR", "S-TOMORROW");
    }

    @Test
    void sameDoctorSlotsOutsideWindowAreSkippedBySpecialtySearch() {
        slot("S1", 1, 0);
        slot("S-LATE", "DOC-1", "cardiology", TODAY, "15:00", 1, 0);
        slot("S-DOC2", "DOC-2", "cardiology", TODAY, "15:00", 1, 0);

        assertThat(reallocationService.candidateSlots(reload("S1"), configurationService.snapshot(), false))
                .extracting(Slot::getSlotId)
                .containsExactly("S-DOC2");
    }

    @Test
    void relocatedTokenIsStampedWithTheClock() {
        slot("S1", 1, 0);
        slot("S2", "DOC-1", "cardiology", TODAY, "10:00", 1, 0);
        Token token = existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);
        suspend("S1");
        clock.advance(Duration.ofMinutes(45));

        BatchReallocationResult result = reallocationService.reallocateBatch(BatchReallocationRequest.builder()
                .slotId("S1").build());

        Token original = reloadToken(token.getTokenId());
        Token copy = reloadToken(result.relocated().get(0).newTokenId());
        assertThat(original.getUpdatedAt()).isEqualTo(clock.instant());
        assertThat(copy.getCreatedAt()).isEqualTo(clock.instant());
        assertThat(reload("S1").getUpdatedAt()).isEqualTo(clock.instant());
        assertThat(reload("S2").getUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void doctorAndDateRangeSelectTokens() {
        slot("S1", 2, 0);
        slot("S-DOC2", "DOC-2", "cardiology", TODAY, "09:00", 2, 0);
        slot("S-SPARE", "DOC-1", "cardiology", TODAY, "10:00", 5, 0);
        existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);
        Token untouched = existingToken("S-DOC2", "P2", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);
        suspend("S1");

        BatchReallocationResult result = reallocationService.reallocateBatch(BatchReallocationRequest.builder()
                .doctorId("DOC-1").dateFrom(TODAY).dateTo(TODAY).statuses(List.of(TokenStatus.ALLOCATED))
                .build());

        assertThat(result.relocated()).hasSize(1);
        assertThat(result.relocated().get(0).toSlotId()).isEqualTo("S-SPARE");
        assertThat(reloadToken(untouched.getTokenId()).getStatus()).isEqualTo(TokenStatus.ALLOCATED);
    }

    @Test
    void onlyActiveStatusesCanBeRequested() {
        assertThatThrownBy(() -> reallocationService.reallocateBatch(BatchReallocationRequest.builder()
                .statuses(List.of(TokenStatus.COMPLETED)).build()))
                .isInstanceOfSatisfying(AllocationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
        assertThatThrownBy(() -> reallocationService.reallocateBatch(BatchReallocationRequest.builder()
                .dateFrom(TODAY).dateTo(TODAY.minusDays(1)).build()))
                .isInstanceOf(AllocationException.class);
    }

    @Test
    void displacedTokenWithoutHomeStaysPending() {
        slot("S1", 1, 0);
        Token token = existingToken("S1", "P1", TokenSource.WALKIN, 200, TokenStatus.CANCELLED);

        PreemptedToken outcome = reallocationService.reallocateDisplaced(token);

        assertThat(outcome.reallocationStatus()).isEqualTo(ReallocationStatus.PENDING_REALLOCATION);
        assertThat(outcome.reallocatedToTokenId()).isNull();
    }

    private void suspend(String slotId) {
        Slot slot = reload(slotId);
        slot.setStatus(Slot.Status.SUSPENDED);
        slotRepository.save(slot);
    }
}
