package com.hospital.opd.config;

import com.hospital.opd.entity.TokenSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of every runtime tunable at one instant.
 */
public record ConfigSnapshot(
        Map<TokenSource, Integer> basePriorities,
        int defaultSlotCapacity,
        int emergencyReservePercentage,
        int consultationMinutes,
        int bufferMinutes,
        int reallocationWindowHours,
        int preemptionThreshold,
        int reallocationSearchLimit,
        List<ReallocationScope> reallocationOrder
) {

    public ConfigSnapshot {
        basePriorities = Map.copyOf(new EnumMap<>(basePriorities));
        reallocationOrder = List.copyOf(reallocationOrder);
    }

    public int basePriority(TokenSource source) {
        return basePriorities.getOrDefault(source, 0);
    }

    public int defaultEmergencyReserve(int maxCapacity) {
        return Math.min(maxCapacity, maxCapacity * emergencyReservePercentage / 100);
    }

    public static ConfigSnapshot fromProperties(OpdProperties properties) {
        Map<TokenSource, Integer> bases = new EnumMap<>(TokenSource.class);
        bases.put(TokenSource.EMERGENCY, properties.getPriority().getEmergency());
        bases.put(TokenSource.PRIORITY, properties.getPriority().getPriority());
        bases.put(TokenSource.FOLLOWUP, properties.getPriority().getFollowup());
        bases.put(TokenSource.ONLINE, properties.getPriority().getOnline());
        bases.put(TokenSource.WALKIN, properties.getPriority().getWalkin());
        List<ReallocationScope> order = properties.getAllocation().getReallocationOrder().stream()
                .map(ReallocationScope::parse)
                .flatMap(java.util.Optional::stream)
                .toList();
        return new ConfigSnapshot(
                bases,
                properties.getCapacity().getDefaultSlotCapacity(),
                properties.getCapacity().getEmergencyReservePercentage(),
                properties.getTiming().getDefaultConsultationMinutes(),
                properties.getTiming().getBufferMinutes(),
                properties.getTiming().getReallocationWindowHours(),
                properties.getAllocation().getPreemptionThreshold(),
                properties.getAllocation().getReallocationSearchLimit(),
                order
        );
    }
}
