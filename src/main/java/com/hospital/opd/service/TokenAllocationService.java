package com.hospital.opd.service;

import com.hospital.opd.component.ConcurrencyController;
import com.hospital.opd.component.OperationGuard;
import com.hospital.opd.component.OperationRegistry;
import com.hospital.opd.component.TokenIssuer;
import com.hospital.opd.config.ConfigSnapshot;
import com.hospital.opd.config.ConfigView;
import com.hospital.opd.dto.AllocationOutcome;
import com.hospital.opd.dto.AllocationRequest;
import com.hospital.opd.dto.EmergencyRequest;
import com.hospital.opd.dto.PatientInfo;
import com.hospital.opd.dto.PreemptedToken;
import com.hospital.opd.dto.TokenView;
import com.hospital.opd.entity.AllocationMethod;
import com.hospital.opd.entity.CancellationReason;
import com.hospital.opd.entity.ReallocationStatus;
import com.hospital.opd.entity.Slot;
import com.hospital.opd.entity.Token;
import com.hospital.opd.entity.TokenMetadata;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.entity.TokenStatus;
import com.hospital.opd.entity.TokenTransition;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns token requests into placed tokens. Always answers with an
 * {@link AllocationOutcome}: a token (placed directly or by preempting a
 * lower-priority one), alternative slots, or a rejection.
 */
@Service
public class TokenAllocationService {

    private static final Logger log = LoggerFactory.getLogger(TokenAllocationService.class);

    private final PriorityCalculator priorityCalculator;
    private final SlotSelector slotSelector;
    private final SlotCapacityManager capacityManager;
    private final ReallocationService reallocationService;
    private final ConcurrencyController concurrency;
    private final TokenIssuer tokenIssuer;
    private final TokenRepository tokenRepository;
    private final SlotRepository slotRepository;
    private final ConfigView configView;
    private final Clock clock;

    public TokenAllocationService(PriorityCalculator priorityCalculator,
                                  SlotSelector slotSelector,
                                  SlotCapacityManager capacityManager,
                                  ReallocationService reallocationService,
                                  ConcurrencyController concurrency,
                                  TokenIssuer tokenIssuer,
                                  TokenRepository tokenRepository,
                                  SlotRepository slotRepository,
                                  ConfigView configView,
                                  Clock clock) {
        this.priorityCalculator = priorityCalculator;
        this.slotSelector = slotSelector;
        this.capacityManager = capacityManager;
        this.reallocationService = reallocationService;
        this.concurrency = concurrency;
        this.tokenIssuer = tokenIssuer;
        this.tokenRepository = tokenRepository;
        this.slotRepository = slotRepository;
        this.configView = configView;
        this.clock = clock;
    }

    public AllocationOutcome allocateToken(AllocationRequest request) {
        String patientId = request != null ? request.getPatientId() : null;
        try {
            return allocate(request);
        } catch (AllocationException e) {
            return reject(patientId, e);
        } catch (DataAccessException e) {
            log.error("Allocation for patient {} failed", patientId, e);
            return internalError(e);
        }
    }

    public AllocationOutcome emergencyInsertion(EmergencyRequest request) {
        String patientId = request != null ? request.getPatientId() : null;
        try {
            return insertEmergency(request);
        } catch (AllocationException e) {
            return reject(patientId, e);
        } catch (DataAccessException e) {
            log.error("Emergency insertion for patient {} failed", patientId, e);
            return internalError(e);
        }
    }

    private AllocationOutcome allocate(AllocationRequest request) {
        validate(request);
        TokenSource source = TokenSource.parse(request.getSource())
                .orElseThrow(() -> AllocationException.validation(
                        PriorityResult.invalidSource(request.getSource()).message(),
                        Map.of("source", String.valueOf(request.getSource()))));
        ConfigSnapshot config = configView.snapshot();
        boolean emergencyAccess = source == TokenSource.EMERGENCY;

        Optional<Slot> target = slotSelector.resolveTarget(request, source);
        if (target.isEmpty()) {
            log.info("No slot for patient {} (doctor={}, department={}), offering alternatives",
                    request.getPatientId(), request.getDoctorId(), request.getDepartment());
            return slotSelector.alternatives(null, request.getDoctorId(), request.getDepartment(),
                    request.preferencesOrEmpty().getPreferredDate(), emergencyAccess);
        }
        Slot slot = target.get();
        if (!slotSelector.isUsable(slot)) {
            throw slotNotAvailable(slot);
        }

        PatientInfo info = request.patientInfoOrEmpty();
        PriorityResult priority = priorityCalculator.calculate(config, source, info,
                request.waitingTimeOrZero(), slot.getDoctorId());
        if (!priority.success()) {
            throw AllocationException.validation(priority.message(), Map.of("source", request.getSource()));
        }

        Placement placement = new Placement(request.getPatientId(), slot.getSlotId(), source, priority,
                info, request.waitingTimeOrZero(), emergencyAccess, true, config.preemptionThreshold());
        return place(placement);
    }

    private AllocationOutcome insertEmergency(EmergencyRequest request) {
        if (request == null || StringUtils.isBlank(request.getPatientId()) || StringUtils.isBlank(request.getDoctorId())) {
            throw AllocationException.validation("patientId and doctorId are required",
                    Map.of("required", List.of("patientId", "doctorId")));
        }
        EmergencyRequest.Urgency urgency = request.getUrgencyLevel() != null
                ? request.getUrgencyLevel() : EmergencyRequest.Urgency.EMERGENCY;
        ConfigSnapshot config = configView.snapshot();
        PatientInfo info = (request.getPatientInfo() != null ? request.getPatientInfo() : PatientInfo.empty())
                .withUrgency(urgency.level());
        PriorityResult priority = priorityCalculator.calculate(config, TokenSource.EMERGENCY, info, 0,
                request.getDoctorId());

        Optional<Slot> slot = chooseEmergencySlot(request, priority.finalPriority(), config.preemptionThreshold());
        if (slot.isEmpty()) {
            log.warn("No slot for emergency patient {} with doctor {}", request.getPatientId(), request.getDoctorId());
            return slotSelector.alternatives(null, request.getDoctorId(), null, slotSelector.today(), true);
        }
        Placement placement = new Placement(request.getPatientId(), slot.get().getSlotId(), TokenSource.EMERGENCY,
                priority, info, 0, true, request.isAllowPreemption(), config.preemptionThreshold());
        return place(placement);
    }

    /**
     * The preferred slot if it can take the patient; else the doctor's first
     * slot today with room; else, when preemption is allowed, the first one
     * holding a token the emergency may displace.
     */
    private Optional<Slot> chooseEmergencySlot(EmergencyRequest request, int requestPriority, int threshold) {
        if (StringUtils.isNotBlank(request.getPreferredSlotId())) {
            Optional<Slot> preferred = slotRepository.findBySlotId(request.getPreferredSlotId())
                    .filter(slotSelector::isUsable)
                    .filter(s -> s.totalAvailable() > 0
                            || (request.isAllowPreemption() && hasVictim(s, requestPriority, threshold)));
            if (preferred.isPresent()) {
                return preferred;
            }
        }
        List<Slot> today = slotRepository.findByDoctorIdAndDateAndStatusAndDeletedFalseOrderByStartTimeAsc(
                        request.getDoctorId(), slotSelector.today(), Slot.Status.ACTIVE).stream()
                .filter(slotSelector::isUsable)
                .toList();
        Optional<Slot> withRoom = today.stream().filter(s -> s.totalAvailable() > 0).findFirst();
        if (withRoom.isPresent() || !request.isAllowPreemption()) {
            return withRoom;
        }
        return today.stream().filter(s -> hasVictim(s, requestPriority, threshold)).findFirst();
    }

    private boolean hasVictim(Slot slot, int requestPriority, int threshold) {
        return tokenRepository.findBySlotIdAndStatusIn(slot.getSlotId(), TokenStatus.ACTIVE).stream()
                .anyMatch(t -> displaceable(t, requestPriority, threshold));
    }

    /** Emergency tokens are never displaced; anyone else only by a margin above the threshold. */
    private static boolean displaceable(Token token, int requestPriority, int threshold) {
        return token.getStatus().isPreemptable()
                && token.getSource() != TokenSource.EMERGENCY
                && requestPriority - token.getPriority() > threshold;
    }

    private AllocationOutcome place(Placement placement) {
        String key = OperationRegistry.allocateKey(placement.slotId(), placement.patientId());
        PlacementResult result;
        try (OperationGuard guard = concurrency.acquire(key)) {
            result = concurrency.executeTransaction(key, concurrency.newDeadline(),
                    attempt -> placeInSlot(placement));
            if (result.token() == null) {
                log.info("Slot {} is full for patient {} (priority {}), offering alternatives",
                        placement.slotId(), placement.patientId(), placement.priority().finalPriority());
                return slotSelector.alternatives(result.fullSlot(), null, null, null, placement.emergencyAccess());
            }
            List<PreemptedToken> preempted = new ArrayList<>();
            for (Token displaced : result.displaced()) {
                preempted.add(reallocationService.reallocateDisplaced(displaced));
            }
            Token token = result.token();
            log.info("Allocated token {} (#{}) in slot {} to patient {} via {} with priority {}",
                    token.getTokenId(), token.getTokenNumber(), token.getSlotId(), token.getPatientId(),
                    result.method(), token.getPriority());
            return new AllocationOutcome.Allocated(TokenView.from(token), result.method(), preempted);
        }
    }

    /** Runs inside the allocation transaction. */
    private PlacementResult placeInSlot(Placement p) {
        Slot slot = capacityManager.lockSlot(p.slotId());
        if (!slotSelector.isUsable(slot)) {
            throw slotNotAvailable(slot);
        }
        if (tokenRepository.existsBySlotIdAndPatientIdAndStatusIn(slot.getSlotId(), p.patientId(), TokenStatus.ACTIVE)) {
            throw new AllocationException(ErrorCode.SCHEDULING_CONFLICT,
                    "Patient " + p.patientId() + " already holds a token in slot " + slot.getSlotId(),
                    Map.of("patientId", p.patientId(), "slotId", slot.getSlotId()),
                    List.of("Use the existing token", "Cancel it before booking again"));
        }

        if (SlotSelector.available(slot, p.emergencyAccess()) > 0) {
            SlotCapacityManager.CapacityReservation reservation =
                    capacityManager.reserveCapacity(slot.getSlotId(), p.emergencyAccess());
            Token token = tokenIssuer.issue(slot, reservation.tokenNumber(), p.patientId(), p.source(),
                    p.priority().finalPriority(), TokenStatus.ALLOCATED, metadata(p, AllocationMethod.DIRECT));
            return new PlacementResult(token, AllocationMethod.DIRECT, List.of(), slot);
        }

        if (p.preemptionAllowed()) {
            Optional<Token> victim = findVictim(slot, p);
            if (victim.isPresent()) {
                int tokenNumber = capacityManager.swapWithinSlot(slot.getSlotId());
                Token token = tokenIssuer.issue(slot, tokenNumber, p.patientId(), p.source(),
                        p.priority().finalPriority(), TokenStatus.ALLOCATED, metadata(p, AllocationMethod.PREEMPTION));
                Token displaced = victim.get();
                TokenTransition.PREEMPT.requireAllowed(displaced);
                displaced.setStatus(TokenTransition.PREEMPT.target());
                displaced.setUpdatedAt(clock.instant());
                TokenMetadata meta = displaced.getMetadata();
                meta.setPreemptedByTokenId(token.getTokenId());
                meta.setPreemptionCause("Preempted by " + p.source().value() + " request with priority "
                        + p.priority().finalPriority());
                meta.setCancellationReason(CancellationReason.PREEMPTED);
                meta.setCancelledBy("system");
                meta.setReallocationStatus(ReallocationStatus.PENDING_REALLOCATION);
                tokenRepository.save(displaced);
                log.info("Token {} (priority {}) preempted by {} (priority {}) in slot {}",
                        displaced.getTokenId(), displaced.getPriority(), token.getTokenId(),
                        token.getPriority(), slot.getSlotId());
                return new PlacementResult(token, AllocationMethod.PREEMPTION, List.of(displaced), slot);
            }
        }
        return new PlacementResult(null, null, List.of(), slot);
    }

    /**
     * Lowest-precedence active token this request may displace. The request
     * must outrank it by more than the preemption threshold, emergencies
     * included. Emergency tokens and tokens in consultation are never displaced.
     */
    private Optional<Token> findVictim(Slot slot, Placement p) {
        int requestPriority = p.priority().finalPriority();
        return tokenRepository.findBySlotIdAndStatusIn(slot.getSlotId(), TokenStatus.ACTIVE).stream()
                .sorted(TokenPrecedence.VICTIM_ORDER)
                .filter(t -> displaceable(t, requestPriority, p.preemptionThreshold()))
                .findFirst();
    }

    private static TokenMetadata metadata(Placement p, AllocationMethod method) {
        PatientInfo info = p.patientInfo();
        return TokenMetadata.builder()
                .allocationMethod(method)
                .urgencyLevel(info.getUrgencyLevel() != null
                        ? info.getUrgencyLevel().name().toLowerCase(Locale.ROOT) : null)
                .priorityLevel(p.priority().priorityLevel().name())
                .basePriority(p.priority().basePriority())
                .waitingTimeMinutes(p.waitingTime())
                .build();
    }

    private static void validate(AllocationRequest request) {
        if (request == null) {
            throw AllocationException.validation("Request body is required", Map.of());
        }
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(request.getPatientId())) {
            missing.add("patientId");
        }
        if (StringUtils.isBlank(request.getSource())) {
            missing.add("source");
        }
        if (StringUtils.isAllBlank(request.getSlotId(), request.getDoctorId(), request.getDepartment())) {
            missing.add("slotId|doctorId|department");
        }
        if (!missing.isEmpty()) {
            throw AllocationException.validation("Missing required fields: " + String.join(", ", missing),
                    Map.of("missing", missing));
        }
    }

    private static AllocationException slotNotAvailable(Slot slot) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("slotId", slot.getSlotId());
        details.put("status", slot.getStatus().name());
        details.put("date", slot.getDate().toString());
        return new AllocationException(ErrorCode.SLOT_NOT_AVAILABLE,
                "Slot " + slot.getSlotId() + " is not available for booking", details,
                List.of("Choose an active slot today or later"));
    }

    private static AllocationOutcome.Rejected reject(String patientId, AllocationException e) {
        AllocationException surfaced = ConcurrencyController.surface(e);
        log.warn("Allocation for patient {} rejected with {}: {}", patientId, surfaced.getCode(), surfaced.getMessage());
        return AllocationOutcome.Rejected.of(surfaced);
    }

    private static AllocationOutcome.Rejected internalError(DataAccessException e) {
        return new AllocationOutcome.Rejected(ErrorCode.INTERNAL_SERVER_ERROR,
                ErrorCode.INTERNAL_SERVER_ERROR.getDefaultMessage(),
                Map.of("cause", e.getClass().getSimpleName()), List.of("Try again later"));
    }

    private record Placement(String patientId, String slotId, TokenSource source, PriorityResult priority,
                             PatientInfo patientInfo, int waitingTime, boolean emergencyAccess,
                             boolean preemptionAllowed, int preemptionThreshold) {
    }

    private record PlacementResult(Token token, AllocationMethod method, List<Token> displaced, Slot fullSlot) {
    }
}
