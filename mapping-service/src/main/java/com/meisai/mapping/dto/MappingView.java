package com.meisai.mapping.dto;

import com.meisai.mapping.entity.MappingRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MappingView {
    private Long id;
    private Long statementRecordId;
    private String externalEntityId;
    private String externalEntityType;
    private Double confidence;
    private String matchType;
    private String status;
    private String rejectionReason;
    private String notes;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    public static MappingView of(MappingRecord m) {
        return MappingView.builder()
                .id(m.getId())
                .statementRecordId(m.getStatementRecordId())
                .externalEntityId(m.getExternalEntityId())
                .externalEntityType(m.getExternalEntityType().wireName())
                .confidence(m.getConfidence())
                .matchType(m.getMatchType().wireName())
                .status(m.getStatus().wireName())
                .rejectionReason(m.getRejectionReason())
                .notes(m.getNotes())
                .createdBy(m.getCreatedBy())
                .createdAt(m.getCreatedAt())
                .updatedAt(m.getUpdatedAt())
                .build();
    }
}
