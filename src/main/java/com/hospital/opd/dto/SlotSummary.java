package com.hospital.opd.dto;

import com.hospital.opd.entity.Slot;

import java.time.LocalDate;
import java.time.LocalTime;

public record SlotSummary(
        String slotId,
        String doctorId,
        String specialty,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        int maxCapacity,
        int currentAllocation,
        int emergencyReserved,
        int lastTokenNumber,
        Slot.Status status,
        long version
) {

    public static SlotSummary from(Slot slot) {
        return new SlotSummary(
                slot.getSlotId(),
                slot.getDoctorId(),
                slot.getSpecialty(),
                slot.getDate(),
                slot.getStartTime(),
                slot.getEndTime(),
                slot.getMaxCapacity(),
                slot.getCurrentAllocation(),
                slot.getEmergencyReserved(),
                slot.getLastTokenNumber(),
                slot.getStatus(),
                slot.getVersion() != null ? slot.getVersion() : 0L
        );
    }
}
