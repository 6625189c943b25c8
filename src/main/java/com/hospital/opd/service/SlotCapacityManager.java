package com.hospital.opd.service;

import com.hospital.opd.entity.Slot;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.exception.ErrorCode;
import com.hospital.opd.repository.SlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns {@code currentAllocation} and {@code lastTokenNumber} of a slot. Every
 * mutation runs inside the caller's transaction while the slot row is locked.
 */
@Service
public class SlotCapacityManager {

    private static final Logger log = LoggerFactory.getLogger(SlotCapacityManager.class);

    private final SlotRepository slotRepository;
    private final Clock clock;

    public SlotCapacityManager(SlotRepository slotRepository, Clock clock) {
        this.slotRepository = slotRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Slot lockSlot(String slotId) {
        return slotRepository.findBySlotIdForUpdate(slotId)
                .orElseThrow(() -> AllocationException.slotNotFound(slotId));
    }

    /**
     * Takes one place in the slot and issues the next token number. Non-emergency
     * callers cannot use the emergency reserve.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CapacityReservation reserveCapacity(String slotId, boolean emergencyAccess) {
        Slot slot = lockSlot(slotId);
        int limit = emergencyAccess ? slot.getMaxCapacity() : slot.getMaxCapacity() - slot.getEmergencyReserved();
        if (slot.getCurrentAllocation() >= limit) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("slotId", slotId);
            details.put("currentAllocation", slot.getCurrentAllocation());
            details.put("maxCapacity", slot.getMaxCapacity());
            details.put("emergencyReserved", slot.getEmergencyReserved());
            details.put("emergencyAccess", emergencyAccess);
            throw new AllocationException(ErrorCode.SLOT_CAPACITY_EXCEEDED,
                    "Slot " + slotId + " has no capacity left", details,
                    List.of("Choose another slot", "Try a different date"));
        }
        slot.setCurrentAllocation(slot.getCurrentAllocation() + 1);
        int tokenNumber = nextTokenNumber(slot);
        slot.setUpdatedAt(clock.instant());
        slotRepository.save(slot);
        log.debug("Reserved slot {}: allocation={} token#{}", slotId, slot.getCurrentAllocation(), tokenNumber);
        return new CapacityReservation(slotId, slot.getCurrentAllocation(), tokenNumber);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int releaseCapacity(String slotId) {
        Slot slot = lockSlot(slotId);
        if (slot.getCurrentAllocation() <= 0) {
            log.warn("Release on slot {} with zero allocation ignored", slotId);
            return 0;
        }
        slot.setCurrentAllocation(slot.getCurrentAllocation() - 1);
        slot.setUpdatedAt(clock.instant());
        slotRepository.save(slot);
        log.debug("Released slot {}: allocation={}", slotId, slot.getCurrentAllocation());
        return slot.getCurrentAllocation();
    }

    /** One token out, one in: allocation unchanged, a fresh number is consumed. */
    @Transactional(propagation = Propagation.MANDATORY)
    public int swapWithinSlot(String slotId) {
        Slot slot = lockSlot(slotId);
        int tokenNumber = nextTokenNumber(slot);
        slot.setUpdatedAt(clock.instant());
        slotRepository.save(slot);
        return tokenNumber;
    }

    @Transactional(readOnly = true)
    public Availability checkAvailability(String slotId, boolean requireEmergencyReserve) {
        Slot slot = slotRepository.findBySlotId(slotId)
                .orElseThrow(() -> AllocationException.slotNotFound(slotId));
        return Availability.of(slot, requireEmergencyReserve);
    }

    private static int nextTokenNumber(Slot slot) {
        int next = slot.getLastTokenNumber() + 1;
        slot.setLastTokenNumber(next);
        return next;
    }

    public record CapacityReservation(String slotId, int newCount, int tokenNumber) {
    }

    public record Availability(String slotId, boolean bookable, int available, int maxCapacity,
                               int currentAllocation, int emergencyReserved) {

        public static Availability of(Slot slot, boolean emergencyAccess) {
            int available = emergencyAccess ? slot.totalAvailable() : slot.regularAvailable();
            return new Availability(slot.getSlotId(), slot.isBookable(), available, slot.getMaxCapacity(),
                    slot.getCurrentAllocation(), slot.getEmergencyReserved());
        }

        public boolean hasCapacity() {
            return bookable && available > 0;
        }
    }
}
