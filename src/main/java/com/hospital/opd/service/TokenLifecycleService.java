package com.hospital.opd.service;

import com.hospital.opd.component.ConcurrencyController;
import com.hospital.opd.component.OperationGuard;
import com.hospital.opd.component.OperationRegistry;
import com.hospital.opd.component.TokenIssuer;
import com.hospital.opd.dto.ActionRequest;
import com.hospital.opd.dto.CancelRequest;
import com.hospital.opd.dto.MoveRequest;
import com.hospital.opd.dto.TokenView;
import com.hospital.opd.entity.AllocationMethod;
import com.hospital.opd.entity.CancellationReason;
import com.hospital.opd.entity.Slot;
import com.hospital.opd.entity.Token;
import com.hospital.opd.entity.TokenMetadata;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.entity.TokenStatus;
import com.hospital.opd.entity.TokenTransition;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import com.hospital.opd.repository.TokenRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * State changes of an existing token. Moves that take a token out of its slot
 * release the slot's capacity in the same transaction.
 */
@Service
public class TokenLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TokenLifecycleService.class);

    /** Reasons a caller may give; the rest are set by the system. */
    static final Set<CancellationReason> CALLER_REASONS = EnumSet.of(
            CancellationReason.PATIENT_REQUEST,
            CancellationReason.DOCTOR_UNAVAILABLE,
            CancellationReason.EMERGENCY,
            CancellationReason.SYSTEM_ERROR,
            CancellationReason.OTHER);

    private final TokenRepository tokenRepository;
    private final SlotCapacityManager capacityManager;
    private final SlotSelector slotSelector;
    private final TokenIssuer tokenIssuer;
    private final ConcurrencyController concurrency;
    private final Clock clock;

    public TokenLifecycleService(TokenRepository tokenRepository,
                                 SlotCapacityManager capacityManager,
                                 SlotSelector slotSelector,
                                 TokenIssuer tokenIssuer,
                                 ConcurrencyController concurrency,
                                 Clock clock) {
        this.tokenRepository = tokenRepository;
        this.capacityManager = capacityManager;
        this.slotSelector = slotSelector;
        this.tokenIssuer = tokenIssuer;
        this.concurrency = concurrency;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public TokenView getToken(String tokenId) {
        return TokenView.from(findToken(tokenId));
    }

    @Transactional(readOnly = true)
    public List<TokenView> tokensForPatient(String patientId) {
        return tokenRepository.findByPatientIdOrderByCreatedAtDesc(patientId).stream()
                .map(TokenView::from)
                .toList();
    }

    public TokenView cancel(String tokenId, CancelRequest request) {
        CancellationReason reason = request != null ? request.getReason() : null;
        if (reason == null || !CALLER_REASONS.contains(reason)) {
            throw AllocationException.validation("reason must be one of " + CALLER_REASONS,
                    Map.of("reason", String.valueOf(reason)));
        }
        String cancelledBy = request.getCancelledBy();
        return guarded(tokenId, () -> concurrency.executeTransaction("cancel:" + tokenId, concurrency.newDeadline(),
                attempt -> {
                    Token token = findToken(tokenId);
                    TokenTransition.CANCEL.requireAllowed(token);
                    capacityManager.lockSlot(token.getSlotId());
                    token.setStatus(TokenTransition.CANCEL.target());
                    token.getMetadata().setCancellationReason(reason);
                    token.getMetadata().setCancelledBy(cancelledBy);
                    token.getMetadata().setLastActor(cancelledBy);
                    if (StringUtils.isNotBlank(request.getNotes())) {
                        token.getMetadata().setNotes(request.getNotes());
                    }
                    touch(token);
                    Token saved = tokenRepository.saveAndFlush(token);
                    capacityManager.releaseCapacity(token.getSlotId());
                    log.info("Token {} cancelled ({}) by {}", tokenId, reason, cancelledBy);
                    return TokenView.from(saved);
                }));
    }

    /**
     * Moves a token to another slot. The patient gets a new token there with
     * the same priority and source; the old one is cancelled as moved.
     */
    public TokenView move(String tokenId, MoveRequest request) {
        String newSlotId = request != null ? request.getNewSlotId() : null;
        if (StringUtils.isBlank(newSlotId)) {
            throw AllocationException.validation("newSlotId is required", Map.of("tokenId", String.valueOf(tokenId)));
        }
        String actor = request.getActorId();
        return guarded(tokenId, () -> concurrency.executeTransaction("move:" + tokenId, concurrency.newDeadline(),
                attempt -> {
                    Token token = findToken(tokenId);
                    TokenTransition.CANCEL.requireAllowed(token);
                    String originId = token.getSlotId();
                    if (originId.equals(newSlotId)) {
                        throw AllocationException.validation("Token is already in slot " + newSlotId,
                                Map.of("tokenId", tokenId, "slotId", newSlotId));
                    }
                    // fixed lock order between the two slots
                    Slot target;
                    if (originId.compareTo(newSlotId) < 0) {
                        capacityManager.lockSlot(originId);
                        target = capacityManager.lockSlot(newSlotId);
                    } else {
                        target = capacityManager.lockSlot(newSlotId);
                        capacityManager.lockSlot(originId);
                    }
                    if (!slotSelector.isUsable(target)) {
                        throw new AllocationException(ErrorCode.SLOT_NOT_AVAILABLE,
                                "Slot " + newSlotId + " is not available for booking",
                                Map.of("slotId", newSlotId, "status", target.getStatus().name()));
                    }
                    if (tokenRepository.existsBySlotIdAndPatientIdAndStatusIn(
                            newSlotId, token.getPatientId(), TokenStatus.ACTIVE)) {
                        throw new AllocationException(ErrorCode.SCHEDULING_CONFLICT,
                                "Patient " + token.getPatientId() + " already holds a token in slot " + newSlotId,
                                Map.of("patientId", token.getPatientId(), "slotId", newSlotId));
                    }
                    SlotCapacityManager.CapacityReservation reservation = capacityManager.reserveCapacity(
                            newSlotId, token.getSource() == TokenSource.EMERGENCY);

                    TokenMetadata previous = token.getMetadata();
                    TokenMetadata metadata = TokenMetadata.builder()
                            .allocationMethod(AllocationMethod.REALLOCATION)
                            .originalSlotId(originId)
                            .originalTokenId(tokenId)
                            .urgencyLevel(previous.getUrgencyLevel())
                            .priorityLevel(previous.getPriorityLevel())
                            .basePriority(previous.getBasePriority())
                            .waitingTimeMinutes(previous.getWaitingTimeMinutes())
                            .lastActor(actor)
                            .build();
                    Token moved = tokenIssuer.issue(target, reservation.tokenNumber(), token.getPatientId(),
                            token.getSource(), token.getPriority(), token.getStatus(), metadata);

                    token.setStatus(TokenTransition.CANCEL.target());
                    previous.setCancellationReason(CancellationReason.MOVED);
                    previous.setCancelledBy(actor);
                    previous.setLastActor(actor);
                    previous.setReallocatedToTokenId(moved.getTokenId());
                    touch(token);
                    tokenRepository.saveAndFlush(token);
                    capacityManager.releaseCapacity(originId);
                    log.info("Token {} moved from slot {} to slot {} as {}", tokenId, originId, newSlotId,
                            moved.getTokenId());
                    return TokenView.from(moved);
                }));
    }

    public TokenView confirm(String tokenId, ActionRequest request) {
        return transition(tokenId, TokenTransition.CONFIRM, request);
    }

    public TokenView start(String tokenId, ActionRequest request) {
        return transition(tokenId, TokenTransition.START, request);
    }

    public TokenView complete(String tokenId, ActionRequest request) {
        return transition(tokenId, TokenTransition.COMPLETE, request);
    }

    public TokenView markNoShow(String tokenId, ActionRequest request) {
        return transition(tokenId, TokenTransition.NOSHOW, request);
    }

    private TokenView transition(String tokenId, TokenTransition transition, ActionRequest request) {
        String actor = request != null ? request.getActorId() : null;
        String notes = request != null ? request.getNotes() : null;
        String context = transition.name().toLowerCase(Locale.ROOT) + ":" + tokenId;
        if (!transition.releasesCapacity()) {
            Token updated = guarded(tokenId, () -> concurrency.updateWithOptimisticLock(context, tokenRepository,
                    () -> findToken(tokenId),
                    token -> apply(token, transition, actor, notes)));
            log.info("Token {} -> {} by {}", tokenId, updated.getStatus(), actor);
            return TokenView.from(updated);
        }
        return guarded(tokenId, () -> concurrency.executeTransaction(context, concurrency.newDeadline(), attempt -> {
            Token token = findToken(tokenId);
            transition.requireAllowed(token);
            capacityManager.lockSlot(token.getSlotId());
            apply(token, transition, actor, notes);
            Token saved = tokenRepository.saveAndFlush(token);
            capacityManager.releaseCapacity(token.getSlotId());
            log.info("Token {} -> {} by {}", tokenId, saved.getStatus(), actor);
            return TokenView.from(saved);
        }));
    }

    private void apply(Token token, TokenTransition transition, String actor, String notes) {
        transition.requireAllowed(token);
        token.setStatus(transition.target());
        token.getMetadata().setLastActor(actor);
        if (StringUtils.isNotBlank(notes)) {
            token.getMetadata().setNotes(notes);
        }
        touch(token);
    }

    private void touch(Token token) {
        token.setUpdatedAt(clock.instant());
    }

    private Token findToken(String tokenId) {
        return tokenRepository.findByTokenId(tokenId).orElseThrow(() -> AllocationException.tokenNotFound(tokenId));
    }

    private <T> T guarded(String tokenId, Supplier<T> work) {
        try (OperationGuard guard = concurrency.acquire(OperationRegistry.tokenKey("token", tokenId))) {
            return work.get();
        } catch (AllocationException e) {
            throw ConcurrencyController.surface(e);
        }
    }
}
