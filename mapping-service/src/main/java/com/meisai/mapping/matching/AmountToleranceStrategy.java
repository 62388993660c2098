package com.meisai.mapping.matching;

import com.meisai.mapping.entity.MatchType;

import java.util.OptionalDouble;

/**
 * Same usage, slightly different toll amount. The allowed difference is the larger of the
 * absolute and the percentage tolerance; either one set to 0 is ignored.
 */
public class AmountToleranceStrategy implements MatchStrategy {

    private final int absoluteTolerance;
    private final double percentTolerance;
    private final double maxConfidence;
    private final double minConfidence;

    public AmountToleranceStrategy(int absoluteTolerance, double percentTolerance,
                                   double maxConfidence, double minConfidence) {
        this.absoluteTolerance = absoluteTolerance;
        this.percentTolerance = percentTolerance;
        this.maxConfidence = maxConfidence;
        this.minConfidence = minConfidence;
    }

    @Override
    public MatchType type() {
        return MatchType.AMOUNT;
    }

    @Override
    public OptionalDouble score(MatchFields record, MatchFields candidate) {
        if (record.getAmount() == null || candidate.getAmount() == null
                || !record.sameDate(candidate) || !record.sameTime(candidate) || !record.sameRoute(candidate)) {
            return OptionalDouble.empty();
        }
        int delta = Math.abs(record.getAmount() - candidate.getAmount());
        double allowed = allowedDelta(record.getAmount());
        if (delta == 0 || allowed <= 0 || delta > allowed) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(maxConfidence - (maxConfidence - minConfidence) * (delta / allowed));
    }

    double allowedDelta(int amount) {
        double byPercent = percentTolerance > 0 ? Math.abs(amount) * percentTolerance / 100.0 : 0;
        return Math.max(Math.max(absoluteTolerance, 0), byPercent);
    }
}
