package com.meisai.mapping.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code POST /mappings/propose}. Without candidates the registered ones around the
 * record date are used. With {@code persist} the proposals are stored as pending mappings.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProposeRequest {
    private Long statementRecordId;
    private List<CandidateRequest> candidates;
    private boolean persist;
    private String createdBy;
}
