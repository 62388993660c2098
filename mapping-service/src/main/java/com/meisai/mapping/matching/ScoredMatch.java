package com.meisai.mapping.matching;

import com.meisai.mapping.entity.ExternalEntityType;
import com.meisai.mapping.entity.MatchType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScoredMatch {
    private String candidateId;
    private ExternalEntityType entityType;
    private double confidence;
    private MatchType matchType;
}
