package com.hospital.opd.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmergencyRequest {

    public enum Urgency {
        HIGH(UrgencyLevel.HIGH),
        EMERGENCY(UrgencyLevel.CRITICAL);

        private final UrgencyLevel level;

        Urgency(UrgencyLevel level) {
            this.level = level;
        }

        /** Urgency applied to the priority calculation. */
        public UrgencyLevel level() {
            return level;
        }
    }

    private String patientId;
    private String doctorId;
    private String preferredSlotId;
    private PatientInfo patientInfo;

    @Builder.Default
    private Urgency urgencyLevel = Urgency.EMERGENCY;

    @Builder.Default
    private boolean allowPreemption = true;
}
