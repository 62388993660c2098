package com.meisai.mapping.matching;

import com.meisai.mapping.config.MatchingProperties;
import com.meisai.mapping.entity.ExternalCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Scores candidates against a statement record. Every strategy is tried on every candidate and
 * the best single result is kept, so a strong match on one dimension is never averaged down by
 * a weak one. Candidates below the acceptance threshold are dropped; the rest come back best first.
 */
@Slf4j
@Component
public class MatchEngine {

    private final List<MatchStrategy> strategies;
    private final double acceptanceThreshold;

    @Autowired
    public MatchEngine(MatchingProperties properties) {
        this(defaultStrategies(properties), properties.getAcceptanceThreshold());
    }

    MatchEngine(List<MatchStrategy> strategies, double acceptanceThreshold) {
        this.strategies = List.copyOf(strategies);
        this.acceptanceThreshold = acceptanceThreshold;
    }

    public static List<MatchStrategy> defaultStrategies(MatchingProperties p) {
        return List.of(
                new ExactMatchStrategy(),
                new TimeWindowStrategy(p.getTimeToleranceMinutes(), p.getTimeMaxConfidence(), p.getTimeMinConfidence()),
                new AmountToleranceStrategy(p.getAmountAbsoluteTolerance(), p.getAmountPercentTolerance(),
                        p.getAmountMaxConfidence(), p.getAmountMinConfidence()),
                new FuzzyTextStrategy(p.getFuzzyMinSimilarity(), p.getFuzzyMaxConfidence())
        );
    }

    public List<ScoredMatch> propose(MatchFields record, List<ExternalCandidate> candidates) {
        List<ScoredMatch> matches = new ArrayList<>();
        for (ExternalCandidate candidate : candidates) {
            ScoredMatch best = best(record, candidate);
            if (best != null && best.getConfidence() >= acceptanceThreshold) {
                matches.add(best);
            }
        }
        matches.sort(Comparator.comparingDouble(ScoredMatch::getConfidence).reversed());
        log.debug("Scored {} candidates, {} above threshold {}", candidates.size(), matches.size(), acceptanceThreshold);
        return matches;
    }

    private ScoredMatch best(MatchFields record, ExternalCandidate candidate) {
        MatchFields other = MatchFields.of(candidate);
        ScoredMatch best = null;
        for (MatchStrategy strategy : strategies) {
            OptionalDouble score = strategy.score(record, other);
            // strict comparison: on a tie the earlier strategy keeps the match
            if (score.isPresent() && (best == null || score.getAsDouble() > best.getConfidence())) {
                best = ScoredMatch.builder()
                        .candidateId(candidate.getEntityId())
                        .entityType(candidate.getEntityType())
                        .confidence(score.getAsDouble())
                        .matchType(strategy.type())
                        .build();
            }
        }
        return best;
    }
}
