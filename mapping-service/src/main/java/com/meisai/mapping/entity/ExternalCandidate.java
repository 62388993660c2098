package com.meisai.mapping.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/** An external accounting record registered for automatic matching. */
@Entity
@Table(name = "external_candidate",
        uniqueConstraints = @UniqueConstraint(name = "uk_candidate_entity",
                columnNames = {"entity_type", "entity_id"}),
        indexes = @Index(name = "idx_candidate_date", columnList = "usage_date"))
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ExternalCandidate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 32)
    private ExternalEntityType entityType;

    @Column(name = "usage_date", nullable = false)
    private LocalDate date;

    @Column(name = "usage_time")
    private LocalTime time;

    private String entryPoint;
    private String exitPoint;
    private Integer amount;
    private String vehicleNumber;

    private Instant registeredAt;

    @PrePersist
    @PreUpdate
    void touch() {
        registeredAt = Instant.now();
    }
}
