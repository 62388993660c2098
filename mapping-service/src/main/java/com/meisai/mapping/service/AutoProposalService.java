package com.meisai.mapping.service;

import com.meisai.common.model.StatementRecordEvent;
import com.meisai.mapping.config.MatchingProperties;
import com.meisai.mapping.dto.MappingView;
import com.meisai.mapping.entity.ExternalCandidate;
import com.meisai.mapping.matching.MatchEngine;
import com.meisai.mapping.matching.MatchFields;
import com.meisai.mapping.matching.ScoredMatch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/** Runs the match engine for every newly ingested statement record. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoProposalService {

    private final CandidateService candidateService;
    private final MatchEngine matchEngine;
    private final MappingService mappingService;
    private final MatchingProperties properties;

    public List<MappingView> proposeFor(StatementRecordEvent event) {
        if (event.getRecordId() == null) {
            log.warn("Ignoring statement event without record id, hash={}", event.getContentHash());
            return List.of();
        }
        List<ExternalCandidate> candidates = candidateService.around(event.getDate());
        if (candidates.isEmpty()) {
            log.debug("No candidates around {} for statement {}", event.getDate(), event.getRecordId());
            return List.of();
        }
        List<ScoredMatch> matches = matchEngine.propose(MatchFields.of(event), candidates);
        return mappingService.createProposed(event.getRecordId(), matches, properties.getAutoPropose().getCreatedBy());
    }
}
