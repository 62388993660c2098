package com.meisai.mapping.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of {@code PATCH /mappings/{id}}; null fields are left unchanged. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UpdateMappingRequest {
    private Double confidence;
    private String status;
    private String notes;
    private String rejectionReason;
}
