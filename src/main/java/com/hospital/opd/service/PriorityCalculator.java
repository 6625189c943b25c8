package com.hospital.opd.service;

import com.hospital.opd.config.ConfigSnapshot;
import com.hospital.opd.config.ConfigView;
import com.hospital.opd.dto.MedicalHistory;
import com.hospital.opd.dto.PatientInfo;
import com.hospital.opd.entity.TokenSource;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps (source, patient attributes, waiting time) to a score in [0, 2000].
 * Deterministic for a given configuration snapshot; performs no I/O beyond
 * reading the snapshot.
 */
@Service
public class PriorityCalculator {

    private static final Logger log = LoggerFactory.getLogger(PriorityCalculator.class);

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 2000;

    private static final int ELDERLY_AGE = 65;
    private static final int PEDIATRIC_AGE = 12;
    private static final int ELDERLY_BONUS = 50;
    private static final int PEDIATRIC_BONUS = 30;
    private static final int CRITICAL_CONDITION_BONUS = 100;
    private static final int CHRONIC_CONDITION_BONUS = 40;
    private static final int CONTINUITY_BONUS = 25;
    private static final int MINUTES_PER_WAITING_POINT = 5;
    private static final int MAX_WAITING_BONUS = 100;

    private final ConfigView configView;

    public PriorityCalculator(ConfigView configView) {
        this.configView = configView;
    }

    public PriorityResult calculate(String source, PatientInfo patientInfo, int waitingTimeMinutes) {
        return calculate(source, patientInfo, waitingTimeMinutes, null);
    }

    public PriorityResult calculate(String source, PatientInfo patientInfo, int waitingTimeMinutes, String targetDoctorId) {
        Optional<TokenSource> parsed = TokenSource.parse(source);
        if (parsed.isEmpty()) {
            log.debug("Rejected priority calculation for unknown source {}", source);
            return PriorityResult.invalidSource(source);
        }
        return calculate(configView.snapshot(), parsed.get(), patientInfo, waitingTimeMinutes, targetDoctorId);
    }

    public PriorityResult calculate(ConfigSnapshot config, TokenSource source, PatientInfo patientInfo,
                                    int waitingTimeMinutes, String targetDoctorId) {
        if (source == null) {
            return PriorityResult.invalidSource(null);
        }
        PatientInfo info = patientInfo != null ? patientInfo : PatientInfo.empty();
        int base = config.basePriority(source);
        Map<String, Integer> breakdown = new LinkedHashMap<>();

        Integer age = info.getAge();
        if (age != null) {
            if (age >= ELDERLY_AGE) {
                breakdown.put("elderly", ELDERLY_BONUS);
            } else if (age <= PEDIATRIC_AGE) {
                breakdown.put("pediatric", PEDIATRIC_BONUS);
            }
        }

        MedicalHistory history = info.getMedicalHistory();
        if (history != null) {
            if (history.isCritical()) breakdown.put("criticalCondition", CRITICAL_CONDITION_BONUS);
            if (history.isChronic()) breakdown.put("chronicCondition", CHRONIC_CONDITION_BONUS);
        }

        if (info.getUrgencyLevel() != null && info.getUrgencyLevel().modifier() > 0) {
            breakdown.put("urgency", info.getUrgencyLevel().modifier());
        }

        if (info.isFollowup()
                && StringUtils.isNotBlank(info.getLastVisitedDoctor())
                && StringUtils.equals(info.getLastVisitedDoctor(), targetDoctorId)) {
            breakdown.put("followupContinuity", CONTINUITY_BONUS);
        }

        int waitingBonus = Math.min(MAX_WAITING_BONUS, Math.max(0, waitingTimeMinutes) / MINUTES_PER_WAITING_POINT);
        if (waitingBonus > 0) {
            breakdown.put("waitingTime", waitingBonus);
        }

        int total = base + breakdown.values().stream().mapToInt(Integer::intValue).sum();
        int finalPriority = Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, total));
        return PriorityResult.success(source, base, finalPriority, breakdown);
    }
}
