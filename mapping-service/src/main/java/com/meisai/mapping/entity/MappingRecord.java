package com.meisai.mapping.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Link between one statement record and one external accounting entity.
 * {@code activeSlot} is only filled while the mapping is active; its unique constraint keeps
 * a single active mapping per (statement record, entity type) even under concurrent confirms.
 */
@Entity
@Table(name = "mapping_record",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_mapping_active_slot", columnNames = {"active_slot"}),
                @UniqueConstraint(name = "uk_mapping_pair",
                        columnNames = {"statement_record_id", "external_entity_type", "external_entity_id"})
        },
        indexes = {
                @Index(name = "idx_mapping_statement", columnList = "statement_record_id"),
                @Index(name = "idx_mapping_status", columnList = "status")
        })
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class MappingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "statement_record_id", nullable = false)
    private Long statementRecordId;

    @Column(name = "external_entity_id", nullable = false)
    private String externalEntityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "external_entity_type", nullable = false, length = 32)
    private ExternalEntityType externalEntityType;

    private Double confidence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MatchType matchType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MappingStatus status;

    private String rejectionReason;

    @Column(length = 1000)
    private String notes;

    private String createdBy;

    @Column(name = "active_slot", length = 64)
    private String activeSlot;

    @Version
    private Long version;

    private Instant createdAt;
    private Instant updatedAt;

    public static String slotOf(Long statementRecordId, ExternalEntityType type) {
        return statementRecordId + ":" + type.name();
    }

    public String slot() {
        return slotOf(statementRecordId, externalEntityType);
    }

    /** Sets the status without checking the transition; callers validate first. */
    public void moveTo(MappingStatus target) {
        status = target;
        syncActiveSlot();
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
        syncActiveSlot();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
        syncActiveSlot();
    }

    void syncActiveSlot() {
        activeSlot = status == MappingStatus.ACTIVE ? slot() : null;
    }
}
