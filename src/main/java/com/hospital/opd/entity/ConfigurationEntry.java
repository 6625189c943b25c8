package com.hospital.opd.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Runtime override of a tunable; absent keys fall back to application properties.
 */
@Entity
@Table(name = "configurations", indexes = {
    @Index(name = "idx_configurations_category", columnList = "category")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConfigurationEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "config_key", nullable = false, unique = true, length = 100)
    private String configKey;

    @Column(name = "config_value", nullable = false, length = 500)
    private String configValue;

    @Column(nullable = false, length = 30)
    private String category;

    @Column(length = 500)
    private String description;

    @Column(name = "updated_by", nullable = false, length = 100)
    private String updatedBy;

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Version
    private Long version;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
