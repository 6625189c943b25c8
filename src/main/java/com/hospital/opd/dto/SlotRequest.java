package com.hospital.opd.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Slot definition. Missing capacity and reserve fall back to the configured
 * defaults.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SlotRequest {
    private String slotId;
    private String doctorId;
    private String specialty;
    private LocalDate date;
    private LocalTime startTime;
    private LocalTime endTime;
    private Integer maxCapacity;
    private Integer emergencyReserved;
}
