package com.meisai.ingest.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One toll usage row of an ETC statement.
 * Business fields are never changed after insert; only externalReferenceNumber is set later
 * (or the whole row replaced when an import runs with updateExisting).
 */
@Entity
@Table(name = "statement_record",
        uniqueConstraints = @UniqueConstraint(columnNames = {"content_hash"}),
        indexes = {
                @Index(name = "idx_statement_usage_date", columnList = "usage_date"),
                @Index(name = "idx_statement_session", columnList = "import_session_id")
        })
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class StatementRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "usage_date", nullable = false)
    private LocalDate date;

    @Column(name = "usage_time", nullable = false)
    private LocalTime time;

    @Column(nullable = false)
    private String entryPoint;

    @Column(nullable = false)
    private String exitPoint;

    @Column(nullable = false)
    private Integer tollAmount;

    @Column(nullable = false)
    private String vehicleNumber;

    @Column(nullable = false)
    private String cardNumber;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    private String externalReferenceNumber;

    // carried from the CSV, outside the fingerprint
    private LocalDate exitDate;
    private LocalTime exitTime;
    private String tollStationName;
    private String usageCategory;
    private String vehicleClass;
    private String remarks;

    private String accountType;
    private String accountId;

    @Column(name = "import_session_id")
    private String importSessionId;

    private Instant createdAt;
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
