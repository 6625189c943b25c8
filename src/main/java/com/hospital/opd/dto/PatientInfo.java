package com.hospital.opd.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Patient attributes that feed the priority score. Everything is optional.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatientInfo {

    private Integer age;

    private MedicalHistory medicalHistory;

    private UrgencyLevel urgencyLevel;

    @JsonAlias("isFollowup")
    private boolean followup;

    private String lastVisitedDoctor;

    public static PatientInfo empty() {
        return new PatientInfo();
    }

    public PatientInfo withUrgency(UrgencyLevel urgency) {
        return new PatientInfo(age, medicalHistory, urgency, followup, lastVisitedDoctor);
    }
}
