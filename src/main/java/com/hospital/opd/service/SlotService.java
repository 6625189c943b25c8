package com.hospital.opd.service;

import com.hospital.opd.component.ConcurrencyController;
import com.hospital.opd.config.ConfigSnapshot;
import com.hospital.opd.config.ConfigView;
import com.hospital.opd.dto.QueueEntry;
import com.hospital.opd.dto.SlotCapacityRequest;
import com.hospital.opd.dto.SlotRequest;
import com.hospital.opd.dto.SlotSummary;
import com.hospital.opd.dto.TokenView;
import com.hospital.opd.entity.Slot;
import com.hospital.opd.entity.Token;
import com.hospital.opd.entity.TokenStatus;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import com.hospital.opd.repository.SlotRepository;
import com.hospital.opd.repository.TokenRepository;
import com.hospital.opd.utils.TokenPrecedence;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class SlotService {

    private static final Logger log = LoggerFactory.getLogger(SlotService.class);

    private static final DateTimeFormatter SLOT_ID_TIME = DateTimeFormatter.ofPattern("HHmm");

    private final SlotRepository slotRepository;
    private final TokenRepository tokenRepository;
    private final SlotCapacityManager capacityManager;
    private final ConcurrencyController concurrency;
    private final ConfigView configView;
    private final Clock clock;

    public SlotService(SlotRepository slotRepository,
                       TokenRepository tokenRepository,
                       SlotCapacityManager capacityManager,
                       ConcurrencyController concurrency,
                       ConfigView configView,
                       Clock clock) {
        this.slotRepository = slotRepository;
        this.tokenRepository = tokenRepository;
        this.capacityManager = capacityManager;
        this.concurrency = concurrency;
        this.configView = configView;
        this.clock = clock;
    }

    /**
     * Creates a slot. Capacity and emergency reserve default to the configured
     * values; the slot id defaults to {@code doctor-date-HHmm}.
     */
    public SlotSummary openSlot(SlotRequest request) {
        validate(request);
        ConfigSnapshot config = configView.snapshot();
        int maxCapacity = request.getMaxCapacity() != null ? request.getMaxCapacity() : config.defaultSlotCapacity();
        int reserved = request.getEmergencyReserved() != null
                ? request.getEmergencyReserved() : config.defaultEmergencyReserve(maxCapacity);
        checkCapacity(maxCapacity, reserved);
        String slotId = StringUtils.isNotBlank(request.getSlotId())
                ? request.getSlotId()
                : request.getDoctorId() + "-" + request.getDate() + "-" + request.getStartTime().format(SLOT_ID_TIME);

        Slot saved = concurrency.executeTransaction("open-slot:" + slotId, concurrency.newDeadline(), attempt -> {
            if (slotRepository.findBySlotId(slotId).isPresent()) {
                throw new AllocationException(ErrorCode.SCHEDULING_CONFLICT, "Slot " + slotId + " already exists",
                        Map.of("slotId", slotId));
            }
            Slot slot = Slot.builder()
                    .slotId(slotId)
                    .doctorId(request.getDoctorId())
                    .specialty(request.getSpecialty())
                    .date(request.getDate())
                    .startTime(request.getStartTime())
                    .endTime(request.getEndTime())
                    .maxCapacity(maxCapacity)
                    .emergencyReserved(reserved)
                    .createdAt(clock.instant())
                    .updatedAt(clock.instant())
                    .build();
            return slotRepository.save(slot);
        });
        log.info("Opened slot {} for doctor {} on {} {}-{} (capacity {}, reserve {})", slotId, saved.getDoctorId(),
                saved.getDate(), saved.getStartTime(), saved.getEndTime(), maxCapacity, reserved);
        return SlotSummary.from(saved);
    }

    public SlotSummary changeSlotStatus(String slotId, Slot.Status status) {
        if (status == null) {
            throw AllocationException.validation("status is required", Map.of("slotId", String.valueOf(slotId)));
        }
        try {
            Slot updated = concurrency.updateWithOptimisticLock("slot-status:" + slotId, slotRepository,
                    () -> slotRepository.findBySlotId(slotId).orElseThrow(() -> AllocationException.slotNotFound(slotId)),
                    slot -> {
                        slot.setStatus(status);
                        slot.setUpdatedAt(clock.instant());
                    });
            log.info("Slot {} status set to {}", slotId, status);
            return SlotSummary.from(updated);
        } catch (AllocationException e) {
            throw ConcurrencyController.surface(e);
        }
    }

    /**
     * Resizes a slot. Capacity can never drop below the tokens already
     * allocated; the reserve is clamped to the new capacity when not given.
     */
    public SlotSummary changeSlotCapacity(String slotId, SlotCapacityRequest request) {
        if (request == null || request.getMaxCapacity() == null) {
            throw AllocationException.validation("maxCapacity is required", Map.of("slotId", String.valueOf(slotId)));
        }
        int maxCapacity = request.getMaxCapacity();
        try {
            Slot updated = concurrency.executeTransaction("slot-capacity:" + slotId, concurrency.newDeadline(),
                    attempt -> {
                        Slot slot = capacityManager.lockSlot(slotId);
                        int reserved = request.getEmergencyReserved() != null
                                ? request.getEmergencyReserved()
                                : Math.min(slot.getEmergencyReserved(), maxCapacity);
                        checkCapacity(maxCapacity, reserved);
                        if (maxCapacity < slot.getCurrentAllocation()) {
                            Map<String, Object> details = new LinkedHashMap<>();
                            details.put("slotId", slotId);
                            details.put("currentAllocation", slot.getCurrentAllocation());
                            details.put("requestedCapacity", maxCapacity);
                            throw new AllocationException(ErrorCode.SCHEDULING_CONFLICT,
                                    "Capacity cannot be lower than the " + slot.getCurrentAllocation()
                                            + " tokens already allocated", details,
                                    List.of("Reallocate or cancel tokens first"));
                        }
                        slot.setMaxCapacity(maxCapacity);
                        slot.setEmergencyReserved(reserved);
                        slot.setUpdatedAt(clock.instant());
                        return slotRepository.saveAndFlush(slot);
                    });
            log.info("Slot {} resized to capacity {} (reserve {})", slotId, updated.getMaxCapacity(),
                    updated.getEmergencyReserved());
            return SlotSummary.from(updated);
        } catch (AllocationException e) {
            throw ConcurrencyController.surface(e);
        }
    }

    @Transactional(readOnly = true)
    public SlotSummary getSlot(String slotId) {
        return SlotSummary.from(slotRepository.findBySlotId(slotId)
                .orElseThrow(() -> AllocationException.slotNotFound(slotId)));
    }

    public SlotCapacityManager.Availability availability(String slotId, boolean emergencyAccess) {
        return capacityManager.checkAvailability(slotId, emergencyAccess);
    }

    /**
     * Active tokens in serve order, each with the time it is expected to start
     * given the configured consultation and buffer minutes.
     */
    @Transactional(readOnly = true)
    public List<QueueEntry> slotQueue(String slotId) {
        Slot slot = slotRepository.findBySlotId(slotId).orElseThrow(() -> AllocationException.slotNotFound(slotId));
        ConfigSnapshot config = configView.snapshot();
        int step = config.consultationMinutes() + config.bufferMinutes();

        List<Token> active = new ArrayList<>(tokenRepository.findBySlotIdAndStatusIn(slotId, TokenStatus.ACTIVE));
        // whoever is in the room goes first
        active.sort((a, b) -> {
            boolean aIn = a.getStatus() == TokenStatus.IN_CONSULTATION;
            boolean bIn = b.getStatus() == TokenStatus.IN_CONSULTATION;
            if (aIn != bIn) {
                return aIn ? -1 : 1;
            }
            return TokenPrecedence.compare(a, b);
        });

        List<QueueEntry> queue = new ArrayList<>();
        LocalTime start = slot.getStartTime();
        for (int i = 0; i < active.size(); i++) {
            queue.add(new QueueEntry(i + 1, TokenView.from(active.get(i)), start.plusMinutes((long) i * step)));
        }
        return queue;
    }

    private static void validate(SlotRequest request) {
        if (request == null) {
            throw AllocationException.validation("Request body is required", Map.of());
        }
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(request.getDoctorId())) missing.add("doctorId");
        if (StringUtils.isBlank(request.getSpecialty())) missing.add("specialty");
        if (request.getDate() == null) missing.add("date");
        if (request.getStartTime() == null) missing.add("startTime");
        if (request.getEndTime() == null) missing.add("endTime");
        if (!missing.isEmpty()) {
            throw AllocationException.validation("Missing required fields: " + String.join(", ", missing),
                    Map.of("missing", missing));
        }
        if (!request.getEndTime().isAfter(request.getStartTime())) {
            throw AllocationException.validation("endTime must be after startTime",
                    Map.of("startTime", request.getStartTime().toString(), "endTime", request.getEndTime().toString()));
        }
    }

    private static void checkCapacity(int maxCapacity, int reserved) {
        if (maxCapacity < 1) {
            throw AllocationException.validation("maxCapacity must be at least 1", Map.of("maxCapacity", maxCapacity));
        }
        if (reserved < 0 || reserved > maxCapacity) {
            throw AllocationException.validation("emergencyReserved must be between 0 and maxCapacity",
                    Map.of("emergencyReserved", reserved, "maxCapacity", maxCapacity));
        }
    }
}
