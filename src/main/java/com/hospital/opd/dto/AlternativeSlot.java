package com.hospital.opd.dto;

import com.hospital.opd.entity.Slot;

import java.time.LocalDate;
import java.time.LocalTime;

/** A slot offered instead of the one requested. */
public record AlternativeSlot(
        String slotId,
        String doctorId,
        String specialty,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        int availableCapacity,
        RecommendedAction category
) {

    public static AlternativeSlot of(Slot slot, RecommendedAction category) {
        return new AlternativeSlot(slot.getSlotId(), slot.getDoctorId(), slot.getSpecialty(),
                slot.getDate(), slot.getStartTime(), slot.getEndTime(), slot.regularAvailable(), category);
    }
}
