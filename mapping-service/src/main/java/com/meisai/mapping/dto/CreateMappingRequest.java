package com.meisai.mapping.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /mappings}. {@code confidence} may be given in [0,1] or [0,100];
 * it is optional for manual mappings and defaults to 1.0.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateMappingRequest {
    private Long statementRecordId;
    private String externalEntityId;
    private String externalEntityType;
    private Double confidence;
    private String matchType;       // defaults to manual
    private String status;          // pending | active, manual only
    private String notes;
    private String createdBy;
}
