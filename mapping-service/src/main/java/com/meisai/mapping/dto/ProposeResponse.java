package com.meisai.mapping.dto;

import com.meisai.mapping.matching.ScoredMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProposeResponse {
    private Long statementRecordId;
    private List<ScoredMatch> matches;
    private List<MappingView> created;
}
