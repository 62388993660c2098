package com.meisai.mapping.matching;

import com.meisai.mapping.entity.MatchType;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.OptionalDouble;

/**
 * Same route and amount, usage times a little apart. The window is measured on date and time
 * together so a pair straddling midnight still matches.
 */
public class TimeWindowStrategy implements MatchStrategy {

    private final long toleranceSeconds;
    private final double maxConfidence;
    private final double minConfidence;

    public TimeWindowStrategy(int toleranceMinutes, double maxConfidence, double minConfidence) {
        this.toleranceSeconds = Duration.ofMinutes(toleranceMinutes).toSeconds();
        this.maxConfidence = maxConfidence;
        this.minConfidence = minConfidence;
    }

    @Override
    public MatchType type() {
        return MatchType.TIME;
    }

    @Override
    public OptionalDouble score(MatchFields record, MatchFields candidate) {
        LocalDateTime a = record.dateTime();
        LocalDateTime b = candidate.dateTime();
        if (a == null || b == null || toleranceSeconds <= 0
                || !record.sameRoute(candidate) || !record.sameAmount(candidate)) {
            return OptionalDouble.empty();
        }
        long delta = Math.abs(Duration.between(a, b).toSeconds());
        if (delta == 0 || delta > toleranceSeconds) {
            return OptionalDouble.empty();
        }
        double ratio = (double) delta / toleranceSeconds;
        return OptionalDouble.of(maxConfidence - (maxConfidence - minConfidence) * ratio);
    }
}
