package com.hospital.opd.service;

import com.hospital.opd.config.OpdProperties;
import com.hospital.opd.dto.AllocationOutcome;
import com.hospital.opd.dto.AllocationRequest;
import com.hospital.opd.dto.AlternativeSlot;
import com.hospital.opd.dto.RecommendedAction;
import com.hospital.opd.dto.SlotSummary;
import com.hospital.opd.entity.Slot;
import com.hospital.opd.entity.TokenSource;
import com.hospital.opd.exception.AllocationException;
import com.hospital.opd.repository.SlotRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the slot a request should land in, and the slots to offer when it
 * cannot.
 */
@Service
public class SlotSelector {

    private static final Logger log = LoggerFactory.getLogger(SlotSelector.class);

    static final int SAME_DOCTOR_FUTURE_DAYS = 7;
    static final int NEXT_AVAILABLE_DAYS = 3;

    private final SlotRepository slotRepository;
    private final Clock clock;
    private final int maxAlternatives;

    public SlotSelector(SlotRepository slotRepository, Clock clock, OpdProperties properties) {
        this.slotRepository = slotRepository;
        this.clock = clock;
        this.maxAlternatives = properties.getAllocation().getMaxAlternatives();
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public Slot requireSlot(String slotId) {
        return slotRepository.findBySlotId(slotId).orElseThrow(() -> AllocationException.slotNotFound(slotId));
    }

    /** Bookable, and neither on a past date nor already over today. */
    public boolean isUsable(Slot slot) {
        if (!slot.isBookable()) {
            return false;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (slot.getDate().isBefore(now.toLocalDate())) {
            return false;
        }
        return !slot.getDate().equals(now.toLocalDate()) || slot.getEndTime().isAfter(now.toLocalTime());
    }

    /**
     * Resolves the target slot of a request. An explicit slot id is returned as
     * is; otherwise the doctor's (or department's) slots on the preferred date
     * are ranked, preferring the patient's last doctor for follow-ups, then the
     * earliest start, then the most free capacity. A full slot is returned only
     * when no slot has room, so preemption can still be attempted there.
     */
    public Optional<Slot> resolveTarget(AllocationRequest request, TokenSource source) {
        if (StringUtils.isNotBlank(request.getSlotId())) {
            return Optional.of(requireSlot(request.getSlotId()));
        }
        AllocationRequest.Preferences preferences = request.preferencesOrEmpty();
        LocalDate date = preferences.getPreferredDate() != null ? preferences.getPreferredDate() : today();
        LocalTime preferredTime = preferences.getPreferredTime();
        boolean emergencyAccess = source == TokenSource.EMERGENCY;

        List<Slot> candidates;
        if (StringUtils.isNotBlank(request.getDoctorId())) {
            candidates = slotRepository.findByDoctorIdAndDateAndStatusAndDeletedFalseOrderByStartTimeAsc(
                    request.getDoctorId(), date, Slot.Status.ACTIVE);
        } else {
            candidates = slotRepository.findBySpecialtyIgnoreCaseAndDateAndStatusAndDeletedFalseOrderByStartTimeAsc(
                    request.getDepartment(), date, Slot.Status.ACTIVE);
        }
        candidates = candidates.stream()
                .filter(this::isUsable)
                .filter(s -> preferredTime == null || !s.getStartTime().isBefore(preferredTime))
                .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        String continuityDoctor = null;
        if (source == TokenSource.FOLLOWUP && request.getPatientInfo() != null
                && StringUtils.isNotBlank(request.getPatientInfo().getLastVisitedDoctor())) {
            continuityDoctor = request.getPatientInfo().getLastVisitedDoctor();
        }
        String preferredDoctor = continuityDoctor;
        Comparator<Slot> ranking = Comparator
                .comparing((Slot s) -> preferredDoctor != null && preferredDoctor.equals(s.getDoctorId()) ? 0 : 1)
                .thenComparing(Slot::getStartTime)
                .thenComparing(s -> -available(s, emergencyAccess))
                .thenComparing(Slot::getSlotId);

        Optional<Slot> withRoom = candidates.stream()
                .filter(s -> available(s, emergencyAccess) > 0)
                .min(ranking);
        if (withRoom.isPresent()) {
            return withRoom;
        }
        return candidates.stream().min(ranking);
    }

    /**
     * Slots to offer instead of {@code requested}: other doctors of the same
     * specialty that day, the same doctor on the following days, then anyone
     * in the specialty over the next days. Earliest first.
     */
    public AllocationOutcome.Alternatives alternatives(Slot requested, String doctorId, String specialty,
                                                       LocalDate date, boolean emergencyAccess) {
        String effectiveDoctor = requested != null ? requested.getDoctorId() : doctorId;
        String effectiveSpecialty = requested != null ? requested.getSpecialty() : specialty;
        LocalDate effectiveDate = requested != null ? requested.getDate() : (date != null ? date : today());
        if (StringUtils.isBlank(effectiveSpecialty) && StringUtils.isNotBlank(effectiveDoctor)) {
            effectiveSpecialty = specialtyOf(effectiveDoctor, effectiveDate).orElse(null);
        }
        String excluded = requested != null ? requested.getSlotId() : null;

        Map<String, AlternativeSlot> found = new LinkedHashMap<>();
        if (StringUtils.isNotBlank(effectiveSpecialty)) {
            slotRepository.findBySpecialtyIgnoreCaseAndDateAndStatusAndDeletedFalseOrderByStartTimeAsc(
                            effectiveSpecialty, effectiveDate, Slot.Status.ACTIVE).stream()
                    .filter(s -> effectiveDoctor == null || !effectiveDoctor.equals(s.getDoctorId()))
                    .filter(s -> offerable(s, excluded, emergencyAccess))
                    .forEach(s -> found.putIfAbsent(s.getSlotId(),
                            AlternativeSlot.of(s, RecommendedAction.SAME_DEPARTMENT_TODAY)));
        }
        if (StringUtils.isNotBlank(effectiveDoctor)) {
            slotRepository.findByDoctorIdAndDateBetweenAndStatusAndDeletedFalseOrderByDateAscStartTimeAsc(
                            effectiveDoctor, effectiveDate.plusDays(1), effectiveDate.plusDays(SAME_DOCTOR_FUTURE_DAYS),
                            Slot.Status.ACTIVE).stream()
                    .filter(s -> offerable(s, excluded, emergencyAccess))
                    .forEach(s -> found.putIfAbsent(s.getSlotId(),
                            AlternativeSlot.of(s, RecommendedAction.SAME_DOCTOR_FUTURE)));
        }
        if (StringUtils.isNotBlank(effectiveSpecialty)) {
            slotRepository.findBySpecialtyIgnoreCaseAndDateBetweenAndStatusAndDeletedFalseOrderByDateAscStartTimeAsc(
                            effectiveSpecialty, effectiveDate, effectiveDate.plusDays(NEXT_AVAILABLE_DAYS),
                            Slot.Status.ACTIVE).stream()
                    .filter(s -> offerable(s, excluded, emergencyAccess))
                    .forEach(s -> found.putIfAbsent(s.getSlotId(),
                            AlternativeSlot.of(s, RecommendedAction.NEXT_AVAILABLE)));
        }

        RecommendedAction recommended = found.values().stream()
                .map(AlternativeSlot::category)
                .min(Comparator.naturalOrder())
                .orElse(RecommendedAction.NO_ALTERNATIVES);
        List<AlternativeSlot> alternatives = found.values().stream()
                .sorted(Comparator.comparing(AlternativeSlot::date)
                        .thenComparing(AlternativeSlot::startTime)
                        .thenComparing(AlternativeSlot::slotId))
                .limit(maxAlternatives)
                .toList();
        log.debug("Found {} alternatives for doctor={} specialty={} date={}",
                alternatives.size(), effectiveDoctor, effectiveSpecialty, effectiveDate);
        return new AllocationOutcome.Alternatives(
                requested != null ? SlotSummary.from(requested) : null,
                alternatives, recommended, suggestions(recommended, alternatives));
    }

    private boolean offerable(Slot slot, String excludedSlotId, boolean emergencyAccess) {
        return !slot.getSlotId().equals(excludedSlotId)
                && isUsable(slot)
                && available(slot, emergencyAccess) > 0;
    }

    private Optional<String> specialtyOf(String doctorId, LocalDate around) {
        return slotRepository.findByDoctorIdAndDateBetweenAndDeletedFalseOrderByDateAscStartTimeAsc(
                        doctorId, around.minusDays(SAME_DOCTOR_FUTURE_DAYS), around.plusDays(SAME_DOCTOR_FUTURE_DAYS))
                .stream()
                .map(Slot::getSpecialty)
                .filter(StringUtils::isNotBlank)
                .findFirst();
    }

    static int available(Slot slot, boolean emergencyAccess) {
        return emergencyAccess ? slot.totalAvailable() : slot.regularAvailable();
    }

    private static List<String> suggestions(RecommendedAction action, List<AlternativeSlot> alternatives) {
        List<String> suggestions = new ArrayList<>();
        switch (action) {
            case SAME_DEPARTMENT_TODAY -> suggestions.add("Another doctor in the same department has room today");
            case SAME_DOCTOR_FUTURE -> suggestions.add("The same doctor has room on a later day");
            case NEXT_AVAILABLE -> suggestions.add("Take the next available slot in the department");
            case NO_ALTERNATIVES -> {
                suggestions.add("No alternative slots are available");
                suggestions.add("Try again later or contact the front desk");
            }
        }
        if (!alternatives.isEmpty()) {
            AlternativeSlot first = alternatives.get(0);
            suggestions.add("Earliest option: " + first.date() + " " + first.startTime() + " with " + first.doctorId());
        }
        return suggestions;
    }
}
