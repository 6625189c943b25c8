package com.hospital.opd.service;

import com.hospital.opd.dto.ActionRequest;
import com.hospital.opd.dto.CancelRequest;
import com.hospital.opd.dto.MoveRequest;
import com.hospital.opd.dto.TokenView;
import com.hospital.opd.entity.AllocationMethod;
import com.hospital.opd.entity.CancellationReason;
import com.hospital.opd.entity.Token;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.entity.TokenStatus;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import com.hospital.opd.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenLifecycleServiceTest extends IntegrationTestSupport {

    @Autowired
    private TokenLifecycleService lifecycleService;

    @Test
    void fullConsultationFlow() {
        slot("S1", 3, 0);
        Token token = existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);
        ActionRequest desk = new ActionRequest("desk-1", null);

        assertThat(lifecycleService.confirm(token.getTokenId(), desk).status()).isEqualTo(TokenStatus.CONFIRMED);
        assertThat(lifecycleService.start(token.getTokenId(), desk).status()).isEqualTo(TokenStatus.IN_CONSULTATION);
        assertThat(reload("S1").getCurrentAllocation()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(20));
        TokenView done = lifecycleService.complete(token.getTokenId(), new ActionRequest("DOC-1", "follow up in 2 weeks"));

        assertThat(done.status()).isEqualTo(TokenStatus.COMPLETED);
        assertThat(done.metadata().getLastActor()).isEqualTo("DOC-1");
        assertThat(done.metadata().getNotes()).isEqualTo("follow up in 2 weeks");
        assertThat(done.updatedAt()).isEqualTo(clock.instant());
        assertThat(reload("S1").getCurrentAllocation()).isZero();
        assertSlotInvariants("S1");
    }

    @Test
    void noShowReleasesCapacity() {
        slot("S1", 3, 0);
        Token token = existingToken("S1", "P1", TokenSource.WALKIN, 200, TokenStatus.CONFIRMED);

        TokenView view = lifecycleService.markNoShow(token.getTokenId(), null);

        assertThat(view.status()).isEqualTo(TokenStatus.NOSHOW);
        assertThat(reload("S1").getCurrentAllocation()).isZero();
    }

    @Test
    void invalidTransitionsAreRefused() {
        slot("S1", 3, 0);
        Token allocated = existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);
        Token completed = existingToken("S1", "P2", TokenSource.ONLINE, 400, TokenStatus.COMPLETED);

        assertThatThrownBy(() -> lifecycleService.complete(allocated.getTokenId(), null))
                .isInstanceOfSatisfying(AllocationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_TOKEN_STATUS));
        assertThatThrownBy(() -> lifecycleService.cancel(completed.getTokenId(),
                new CancelRequest(CancellationReason.PATIENT_REQUEST, "P2", null)))
                .isInstanceOfSatisfying(AllocationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.TOKEN_ALREADY_PROCESSED));
        assertThat(reloadToken(allocated.getTokenId()).getStatus()).isEqualTo(TokenStatus.ALLOCATED);
        assertSlotInvariants("S1");
    }

    @Test
    void cancelRecordsReasonAndReleases() {
        slot("S1", 3, 0);
        Token token = existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);

        TokenView view = lifecycleService.cancel(token.getTokenId(),
                new CancelRequest(CancellationReason.DOCTOR_UNAVAILABLE, "admin", "doctor on leave"));

        assertThat(view.status()).isEqualTo(TokenStatus.CANCELLED);
        assertThat(view.metadata().getCancellationReason()).isEqualTo(CancellationReason.DOCTOR_UNAVAILABLE);
        assertThat(view.metadata().getCancelledBy()).isEqualTo("admin");
        assertThat(reload("S1").getCurrentAllocation()).isZero();
        assertThat(reload("S1").getLastTokenNumber()).isEqualTo(1);
    }

    @Test
    void systemReasonsCannotBeGivenByCallers() {
        slot("S1", 3, 0);
        Token token = existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);

        assertThatThrownBy(() -> lifecycleService.cancel(token.getTokenId(),
                new CancelRequest(CancellationReason.PREEMPTED, "x", null)))
                .isInstanceOfSatisfying(AllocationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
        assertThatThrownBy(() -> lifecycleService.cancel(token.getTokenId(), new CancelRequest()))
                .isInstanceOf(AllocationException.class);
    }

    @Test
    void unknownTokenIsNotFound() {
        assertThatThrownBy(() -> lifecycleService.getToken("TKN-NOPE"))
                .isInstanceOfSatisfying(AllocationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.TOKEN_NOT_FOUND));
        assertThatThrownBy(() -> lifecycleService.confirm("TKN-NOPE", null))
                .isInstanceOfSatisfying(AllocationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.TOKEN_NOT_FOUND));
    }

    @Test
    void moveIssuesNewTokenInTargetSlot() {
        slot("S1", 3, 0);
        slot("S2", "DOC-2", "cardiology", TODAY, "11:00", 3, 0);
        existingToken("S2", "P-X", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);
        Token token = existingToken("S1", "P1", TokenSource.FOLLOWUP, 600, TokenStatus.CONFIRMED);

        TokenView moved = lifecycleService.move(token.getTokenId(), new MoveRequest("S2", "desk-1"));

        assertThat(moved.slotId()).isEqualTo("S2");
        assertThat(moved.doctorId()).isEqualTo("DOC-2");
        assertThat(moved.tokenNumber()).isEqualTo(2);
        assertThat(moved.priority()).isEqualTo(600);
        assertThat(moved.status()).isEqualTo(TokenStatus.CONFIRMED);
        assertThat(moved.metadata().getAllocationMethod()).isEqualTo(AllocationMethod.REALLOCATION);
        assertThat(moved.metadata().getOriginalTokenId()).isEqualTo(token.getTokenId());

        Token old = reloadToken(token.getTokenId());
        assertThat(old.getStatus()).isEqualTo(TokenStatus.CANCELLED);
        assertThat(old.getMetadata().getCancellationReason()).isEqualTo(CancellationReason.MOVED);
        assertThat(old.getMetadata().getReallocatedToTokenId()).isEqualTo(moved.tokenId());
        assertSlotInvariants("S1");
        assertSlotInvariants("S2");
        assertThat(reload("S1").getCurrentAllocation()).isZero();
        assertThat(reload("S2").getCurrentAllocation()).isEqualTo(2);
    }

    @Test
    void moveIntoFullSlotChangesNothing() {
        slot("S1", 3, 0);
        slot("S2", "DOC-1", "cardiology", TODAY, "10:00", 1, 0);
        existingToken("S2", "P-X", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);
        Token token = existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);

        assertThatThrownBy(() -> lifecycleService.move(token.getTokenId(), new MoveRequest("S2", "desk-1")))
                .isInstanceOfSatisfying(AllocationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.SLOT_CAPACITY_EXCEEDED));

        assertThat(reloadToken(token.getTokenId()).getStatus()).isEqualTo(TokenStatus.ALLOCATED);
        assertThat(reload("S1").getCurrentAllocation()).isEqualTo(1);
        assertThat(reload("S2").getCurrentAllocation()).isEqualTo(1);
        assertSlotInvariants("S1");
        assertSlotInvariants("S2");
    }

    @Test
    void moveRejectsDuplicatePatientInTarget() {
        slot("S1", 3, 0);
        slot("S2", "DOC-1", "cardiology", TODAY, "10:00", 3, 0);
        existingToken("S2", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);
        Token token = existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);

        assertThatThrownBy(() -> lifecycleService.move(token.getTokenId(), new MoveRequest("S2", null)))
                .isInstanceOfSatisfying(AllocationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.SCHEDULING_CONFLICT));
    }

    @Test
    void tokensForPatientNewestFirst() {
        slot("S1", 3, 0);
        slot("S2", "DOC-1", "cardiology", TODAY, "10:00", 3, 0);
        existingToken("S1", "P1", TokenSource.ONLINE, 400, TokenStatus.COMPLETED);
        clock.advance(Duration.ofMinutes(5));
        Token later = existingToken("S2", "P1", TokenSource.ONLINE, 400, TokenStatus.ALLOCATED);

        assertThat(lifecycleService.tokensForPatient("P1"))
                .extracting(TokenView::tokenId)
                .first().isEqualTo(later.getTokenId());
        assertThat(lifecycleService.tokensForPatient("P-NONE")).isEmpty();
    }
}
