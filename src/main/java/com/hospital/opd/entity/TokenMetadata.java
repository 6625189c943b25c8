package com.hospital.opd.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.*;

/**
 * Provenance of a token: how it was placed, what displaced it and where it went.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TokenMetadata {

    @Enumerated(EnumType.STRING)
    @Column(name = "allocation_method", length = 20)
    private AllocationMethod allocationMethod;

    @Column(name = "original_slot_id", length = 64)
    private String originalSlotId;

    @Column(name = "original_token_id", length = 64)
    private String originalTokenId;

    @Column(name = "preempted_by_token_id", length = 64)
    private String preemptedByTokenId;

    @Column(name = "preemption_cause", length = 255)
    private String preemptionCause;

    @Column(name = "reallocated_to_token_id", length = 64)
    private String reallocatedToTokenId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reallocation_status", length = 30)
    private ReallocationStatus reallocationStatus;

    @Column(name = "urgency_level", length = 20)
    private String urgencyLevel;

    @Column(name = "priority_level", length = 20)
    private String priorityLevel;

    @Column(name = "base_priority")
    private Integer basePriority;

    @Column(name = "waiting_time_minutes")
    private Integer waitingTimeMinutes;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancellation_reason", length = 30)
    private CancellationReason cancellationReason;

    @Column(name = "cancelled_by", length = 64)
    private String cancelledBy;

    @Column(name = "last_actor", length = 64)
    private String lastActor;

    @Column(name = "notes", length = 500)
    private String notes;
}
