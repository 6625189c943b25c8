package com.hospital.opd.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One patient's numbered claim on a slot. The slot is referenced by its
 * public {@code slotId}; a slot may outlive its tokens.
 */
@Entity
@Table(name = "tokens",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_tokens_slot_number", columnNames = {"slot_id", "token_number"})
    },
    indexes = {
        @Index(name = "idx_tokens_token_id", columnList = "token_id", unique = true),
        @Index(name = "idx_tokens_patient", columnList = "patient_id"),
        @Index(name = "idx_tokens_slot_status", columnList = "slot_id, status"),
        @Index(name = "idx_tokens_status_created", columnList = "status, created_at")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Token {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token_id", nullable = false, unique = true, length = 64)
    private String tokenId;

    @Column(name = "patient_id", nullable = false, length = 64)
    private String patientId;

    @Column(name = "doctor_id", nullable = false, length = 64)
    private String doctorId;

    @Column(name = "slot_id", nullable = false, length = 64)
    private String slotId;

    @Column(name = "token_number", nullable = false)
    private int tokenNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TokenSource source;

    @Column(nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TokenStatus status = TokenStatus.ALLOCATED;

    @Embedded
    @Builder.Default
    private TokenMetadata metadata = new TokenMetadata();

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (updatedAt == null) updatedAt = createdAt;
        if (metadata == null) metadata = new TokenMetadata();
    }

    @PostLoad
    protected void onLoad() {
        // Hibernate leaves an all-null embeddable as null
        if (metadata == null) metadata = new TokenMetadata();
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }
}
