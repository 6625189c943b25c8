package com.hospital.opd.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A doctor's timed window on a given date with a bounded number of tokens.
 * {@code currentAllocation} and {@code lastTokenNumber} are only changed by
 * {@link com.hospital.opd.service.SlotCapacityManager} inside a transaction.
 */
@Entity
@Table(name = "slots", indexes = {
    @Index(name = "idx_slots_slot_id", columnList = "slot_id", unique = true),
    @Index(name = "idx_slots_doctor_date", columnList = "doctor_id, slot_date"),
    @Index(name = "idx_slots_specialty_date", columnList = "specialty, slot_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Slot {

    public enum Status { ACTIVE, SUSPENDED, COMPLETED, CANCELLED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_id", nullable = false, unique = true, length = 64)
    private String slotId;

    @Column(name = "doctor_id", nullable = false, length = 64)
    private String doctorId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "max_capacity", nullable = false)
    private int maxCapacity;

    @Column(name = "current_allocation", nullable = false)
    @Builder.Default
    private int currentAllocation = 0;

    @Column(name = "emergency_reserved", nullable = false)
    @Builder.Default
    private int emergencyReserved = 0;

    @Column(name = "last_token_number", nullable = false)
    @Builder.Default
    private int lastTokenNumber = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.ACTIVE;

    @Column(nullable = false, length = 100)
    private String specialty;

    @Column(nullable = false)
    @Builder.Default
    private boolean deleted = false;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Capacity a non-emergency request may still take. */
    public int regularAvailable() {
        return Math.max(0, maxCapacity - emergencyReserved - currentAllocation);
    }

    /** Capacity an emergency request may still take, reserve included. */
    public int totalAvailable() {
        return Math.max(0, maxCapacity - currentAllocation);
    }

    public boolean isBookable() {
        return status == Status.ACTIVE && !deleted;
    }
}
