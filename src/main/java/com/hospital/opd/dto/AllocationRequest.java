package com.hospital.opd.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Inbound token request. One of {@code slotId}, {@code doctorId} or
 * {@code department} must be present.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AllocationRequest {

    private String patientId;
    private String doctorId;
    private String slotId;
    private String department;
    private String source;
    private PatientInfo patientInfo;
    private Integer waitingTime;
    private Preferences preferences;

    public PatientInfo patientInfoOrEmpty() {
        return patientInfo != null ? patientInfo : PatientInfo.empty();
    }

    public int waitingTimeOrZero() {
        return waitingTime != null ? waitingTime : 0;
    }

    public Preferences preferencesOrEmpty() {
        return preferences != null ? preferences : new Preferences();
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Preferences {
        private LocalDate preferredDate;
        private LocalTime preferredTime;
    }
}
