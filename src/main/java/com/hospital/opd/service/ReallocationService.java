package com.hospital.opd.service;

import com.hospital.opd.component.ConcurrencyController;
import com.hospital.opd.component.TokenIssuer;
import com.hospital.opd.config.ConfigSnapshot;
import com.hospital.opd.config.ConfigView;
import com.hospital.opd.config.ReallocationScope;
import com.hospital.opd.dto.BatchReallocationRequest;
import com.hospital.opd.dto.BatchReallocationResult;
import com.hospital.opd.dto.PreemptedToken;
import com.hospital.opd.entity.AllocationMethod;
import com.hospital.opd.entity.CancellationReason;
import com.hospital.opd.entity.ReallocationStatus;
import com.hospital.opd.entity.Slot;
import com.hospital.opd.entity.Token;
import com.hospital.opd.entity.TokenMetadata;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.entity.TokenStatus;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import com.hospital.opd.repository.SlotRepository;
import com.hospital.opd.repository.TokenRepository;
import com.hospital.opd.utils.TokenPrecedence;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves tokens out of a slot they can no longer be served in: tokens displaced
 * by preemption, and batches of tokens from suspended or cancelled slots.
 * Every token keeps its priority and source.
 */
@Service
public class ReallocationService {

    private static final Logger log = LoggerFactory.getLogger(ReallocationService.class);

    static final Set<TokenStatus> MOVABLE = EnumSet.of(TokenStatus.ALLOCATED, TokenStatus.CONFIRMED);

    private final TokenRepository tokenRepository;
    private final SlotRepository slotRepository;
    private final SlotCapacityManager capacityManager;
    private final SlotSelector slotSelector;
    private final TokenIssuer tokenIssuer;
    private final ConcurrencyController concurrency;
    private final ConfigView configView;
    private final Clock clock;

    public ReallocationService(TokenRepository tokenRepository,
                               SlotRepository slotRepository,
                               SlotCapacityManager capacityManager,
                               SlotSelector slotSelector,
                               TokenIssuer tokenIssuer,
                               ConcurrencyController concurrency,
                               ConfigView configView,
                               Clock clock) {
        this.tokenRepository = tokenRepository;
        this.slotRepository = slotRepository;
        this.capacityManager = capacityManager;
        this.slotSelector = slotSelector;
        this.tokenIssuer = tokenIssuer;
        this.concurrency = concurrency;
        this.configView = configView;
        this.clock = clock;
    }

    /**
     * Finds a new home for a token cancelled by preemption. Runs in its own
     * transaction; on failure the displaced token stays
     * {@code PENDING_REALLOCATION} and that is what gets reported.
     */
    public PreemptedToken reallocateDisplaced(Token displaced) {
        String tokenId = displaced.getTokenId();
        ConfigSnapshot config = configView.snapshot();
        try {
            return concurrency.executeTransaction("reallocate:" + tokenId, concurrency.newDeadline(), attempt -> {
                Token token = tokenRepository.findByTokenId(tokenId)
                        .orElseThrow(() -> AllocationException.tokenNotFound(tokenId));
                Slot origin = slotSelector.requireSlot(token.getSlotId());
                Optional<Token> placed = placeElsewhere(token, origin, config, TokenStatus.ALLOCATED);
                if (placed.isEmpty()) {
                    log.warn("No slot found for displaced token {} (patient {}), left pending",
                            tokenId, token.getPatientId());
                    return PreemptedToken.pending(tokenId, token.getPatientId(), token.getPriority());
                }
                Token target = placed.get();
                token.getMetadata().setReallocatedToTokenId(target.getTokenId());
                token.getMetadata().setReallocationStatus(ReallocationStatus.REALLOCATED);
                token.setUpdatedAt(clock.instant());
                tokenRepository.save(token);
                log.info("Displaced token {} reallocated to {} in slot {}",
                        tokenId, target.getTokenId(), target.getSlotId());
                return new PreemptedToken(tokenId, token.getPatientId(), token.getPriority(),
                        ReallocationStatus.REALLOCATED, target.getTokenId(), target.getSlotId());
            });
        } catch (AllocationException | DataAccessException e) {
            log.error("Reallocation of displaced token {} failed, left pending: {}", tokenId, e.getMessage());
            return PreemptedToken.pending(tokenId, displaced.getPatientId(), displaced.getPriority());
        }
    }

    /**
     * Moves every token matching the request, highest precedence first. Each
     * token is moved in its own transaction so one failure does not undo the
     * others.
     */
    public BatchReallocationResult reallocateBatch(BatchReallocationRequest request) {
        Set<TokenStatus> statuses = statusesOf(request);
        List<Token> tokens = selectTokens(request, statuses);
        ConfigSnapshot config = configView.snapshot();
        String reason = StringUtils.defaultIfBlank(request.getReason(), "batch reallocation");

        List<BatchReallocationResult.Relocated> relocated = new ArrayList<>();
        List<BatchReallocationResult.Failed> failed = new ArrayList<>();
        for (Token candidate : tokens) {
            String tokenId = candidate.getTokenId();
            try {
                BatchReallocationResult.Relocated moved = concurrency.executeTransaction(
                        "reallocate-batch:" + tokenId, concurrency.newDeadline(),
                        attempt -> relocate(tokenId, statuses, reason, config));
                if (moved != null) {
                    relocated.add(moved);
                } else {
                    failed.add(new BatchReallocationResult.Failed(tokenId, ErrorCode.SLOT_NOT_AVAILABLE,
                            "No eligible slot found"));
                }
            } catch (AllocationException e) {
                AllocationException surfaced = ConcurrencyController.surface(e);
                log.warn("Batch reallocation of token {} failed: {}", tokenId, surfaced.getMessage());
                failed.add(new BatchReallocationResult.Failed(tokenId, surfaced.getCode(), surfaced.getMessage()));
            } catch (DataAccessException e) {
                log.error("Batch reallocation of token {} failed on the database: {}", tokenId, e.getMessage(), e);
                failed.add(new BatchReallocationResult.Failed(tokenId, ErrorCode.INTERNAL_SERVER_ERROR,
                        ErrorCode.INTERNAL_SERVER_ERROR.getDefaultMessage()));
            }
        }
        log.info("Batch reallocation ({}): {} relocated, {} failed", reason, relocated.size(), failed.size());
        return new BatchReallocationResult(relocated, failed);
    }

    private BatchReallocationResult.Relocated relocate(String tokenId, Set<TokenStatus> statuses, String reason,
                                                      ConfigSnapshot config) {
        Token token = tokenRepository.findByTokenId(tokenId)
                .orElseThrow(() -> AllocationException.tokenNotFound(tokenId));
        if (!statuses.contains(token.getStatus())) {
            throw new AllocationException(ErrorCode.INVALID_TOKEN_STATUS,
                    "Token " + tokenId + " is " + token.getStatus() + " and can no longer be moved",
                    Map.of("tokenId", tokenId, "status", token.getStatus().name()));
        }
        Slot origin = capacityManager.lockSlot(token.getSlotId());
        Optional<Token> placed = placeElsewhere(token, origin, config, token.getStatus());
        if (placed.isEmpty()) {
            token.getMetadata().setReallocationStatus(ReallocationStatus.PENDING_REALLOCATION);
            token.getMetadata().setNotes(reason);
            token.setUpdatedAt(clock.instant());
            tokenRepository.save(token);
            log.warn("No slot found for token {} from slot {}, marked pending", tokenId, origin.getSlotId());
            return null;
        }
        Token target = placed.get();
        token.setStatus(TokenStatus.CANCELLED);
        token.getMetadata().setCancellationReason(CancellationReason.REALLOCATED);
        token.getMetadata().setReallocatedToTokenId(target.getTokenId());
        token.getMetadata().setReallocationStatus(ReallocationStatus.REALLOCATED);
        token.getMetadata().setNotes(reason);
        token.setUpdatedAt(clock.instant());
        tokenRepository.save(token);
        capacityManager.releaseCapacity(origin.getSlotId());
        return new BatchReallocationResult.Relocated(tokenId, target.getTokenId(), origin.getSlotId(),
                target.getSlotId(), target.getPriority());
    }

    /**
     * Issues a copy of {@code original} in the first candidate slot with room.
     * Must run inside a transaction; candidate slots are locked as they are tried.
     */
    Optional<Token> placeElsewhere(Token original, Slot origin, ConfigSnapshot config, TokenStatus newStatus) {
        boolean emergencyAccess = original.getSource() == TokenSource.EMERGENCY;
        for (Slot candidate : candidateSlots(origin, config, emergencyAccess)) {
            Slot locked = capacityManager.lockSlot(candidate.getSlotId());
            if (!slotSelector.isUsable(locked) || SlotSelector.available(locked, emergencyAccess) <= 0) {
                continue;
            }
            if (tokenRepository.existsBySlotIdAndPatientIdAndStatusIn(
                    locked.getSlotId(), original.getPatientId(), TokenStatus.ACTIVE)) {
                continue;
            }
            SlotCapacityManager.CapacityReservation reservation =
                    capacityManager.reserveCapacity(locked.getSlotId(), emergencyAccess);
            TokenMetadata source = original.getMetadata();
            TokenMetadata metadata = TokenMetadata.builder()
                    .allocationMethod(AllocationMethod.REALLOCATION)
                    .originalSlotId(origin.getSlotId())
                    .originalTokenId(original.getTokenId())
                    .urgencyLevel(source.getUrgencyLevel())
                    .priorityLevel(source.getPriorityLevel())
                    .basePriority(source.getBasePriority())
                    .waitingTimeMinutes(source.getWaitingTimeMinutes())
                    .build();
            Token created = tokenIssuer.issue(locked, reservation.tokenNumber(), original.getPatientId(),
                    original.getSource(), original.getPriority(), newStatus, metadata);
            log.info("Token {} reissued as {} (#{}) in slot {}", original.getTokenId(), created.getTokenId(),
                    created.getTokenNumber(), locked.getSlotId());
            return Optional.of(created);
        }
        return Optional.empty();
    }

    /**
     * Candidate slots in the configured search order, capped at the search
     * limit. Same-day slots of the same doctor must start within the
     * reallocation window of the original slot, whichever scope finds them.
     */
    List<Slot> candidateSlots(Slot origin, ConfigSnapshot config, boolean emergencyAccess) {
        Map<String, Slot> candidates = new LinkedHashMap<>();
        long windowMinutes = config.reallocationWindowHours() * 60L;
        for (ReallocationScope scope : config.reallocationOrder()) {
            List<Slot> found = switch (scope) {
                case SAME_DOCTOR_SAME_DAY -> slotRepository
                        .findByDoctorIdAndDateAndStatusAndDeletedFalseOrderByStartTimeAsc(
                                origin.getDoctorId(), origin.getDate(), Slot.Status.ACTIVE)
                        .stream()
                        .filter(s -> withinWindow(origin, s, windowMinutes))
                        .toList();
                case SAME_SPECIALTY_SAME_DAY -> slotRepository
                        .findBySpecialtyIgnoreCaseAndDateAndStatusAndDeletedFalseOrderByStartTimeAsc(
                                origin.getSpecialty(), origin.getDate(), Slot.Status.ACTIVE)
                        .stream()
                        .filter(s -> !s.getDoctorId().equals(origin.getDoctorId())
                                || withinWindow(origin, s, windowMinutes))
                        .toList();
                case SAME_DOCTOR_NEXT_DAY -> slotRepository
                        .findByDoctorIdAndDateAndStatusAndDeletedFalseOrderByStartTimeAsc(
                                origin.getDoctorId(), origin.getDate().plusDays(1), Slot.Status.ACTIVE);
            };
            for (Slot slot : found) {
                if (candidates.size() >= config.reallocationSearchLimit()) {
                    return new ArrayList<>(candidates.values());
                }
                if (!slot.getSlotId().equals(origin.getSlotId())
                        && slotSelector.isUsable(slot)
                        && SlotSelector.available(slot, emergencyAccess) > 0) {
                    candidates.putIfAbsent(slot.getSlotId(), slot);
                }
            }
        }
        return new ArrayList<>(candidates.values());
    }

    private static boolean withinWindow(Slot origin, Slot slot, long windowMinutes) {
        return Math.abs(ChronoUnit.MINUTES.between(origin.getStartTime(), slot.getStartTime())) <= windowMinutes;
    }

    private Set<TokenStatus> statusesOf(BatchReallocationRequest request) {
        if (request.getStatuses() == null || request.getStatuses().isEmpty()) {
            return EnumSet.copyOf(MOVABLE);
        }
        Set<TokenStatus> statuses = EnumSet.copyOf(request.getStatuses());
        if (!MOVABLE.containsAll(statuses)) {
            throw AllocationException.validation("Only ALLOCATED and CONFIRMED tokens can be reallocated",
                    Map.of("statuses", statuses.toString()));
        }
        return statuses;
    }

    private List<Token> selectTokens(BatchReallocationRequest request, Set<TokenStatus> statuses) {
        List<String> slotIds;
        if (StringUtils.isNotBlank(request.getSlotId())) {
            slotIds = List.of(slotSelector.requireSlot(request.getSlotId()).getSlotId());
        } else {
            LocalDate from = request.getDateFrom() != null ? request.getDateFrom() : slotSelector.today();
            LocalDate to = request.getDateTo() != null ? request.getDateTo() : from;
            if (to.isBefore(from)) {
                throw AllocationException.validation("dateTo is before dateFrom",
                        Map.of("dateFrom", from.toString(), "dateTo", to.toString()));
            }
            List<Slot> slots = StringUtils.isNotBlank(request.getDoctorId())
                    ? slotRepository.findByDoctorIdAndDateBetweenAndDeletedFalseOrderByDateAscStartTimeAsc(
                            request.getDoctorId(), from, to)
                    : slotRepository.findByDateBetweenAndDeletedFalseOrderByDateAscStartTimeAsc(from, to);
            slotIds = slots.stream().map(Slot::getSlotId).toList();
        }
        List<Token> tokens = new ArrayList<>();
        for (String slotId : slotIds) {
            tokens.addAll(tokenRepository.findBySlotIdAndStatusIn(slotId, statuses));
        }
        tokens.sort(TokenPrecedence.SERVE_ORDER);
        return tokens;
    }
}
