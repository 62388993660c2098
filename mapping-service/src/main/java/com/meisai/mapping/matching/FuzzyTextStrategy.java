package com.meisai.mapping.matching;

import com.meisai.mapping.entity.MatchType;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.OptionalDouble;

/**
 * Same date, time and amount with interchange names spelled a little differently.
 * Entry and exit are always compared, the vehicle number only when both sides carry one.
 */
public class FuzzyTextStrategy implements MatchStrategy {

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private final double minSimilarity;
    private final double maxConfidence;

    public FuzzyTextStrategy(double minSimilarity, double maxConfidence) {
        this.minSimilarity = minSimilarity;
        this.maxConfidence = maxConfidence;
    }

    @Override
    public MatchType type() {
        return MatchType.FUZZY;
    }

    @Override
    public OptionalDouble score(MatchFields record, MatchFields candidate) {
        if (!record.sameDate(candidate) || !record.sameTime(candidate) || !record.sameAmount(candidate)) {
            return OptionalDouble.empty();
        }
        double sum = similarity(record.getEntryPoint(), candidate.getEntryPoint())
                + similarity(record.getExitPoint(), candidate.getExitPoint());
        int compared = 2;
        if (!record.getVehicleNumber().isEmpty() && !candidate.getVehicleNumber().isEmpty()) {
            sum += similarity(record.getVehicleNumber(), candidate.getVehicleNumber());
            compared++;
        }
        double average = sum / compared;
        if (average >= 1.0 || average < minSimilarity) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(average * maxConfidence);
    }

    /** 1 - distance / longer length; two empty strings are identical. */
    static double similarity(String a, String b) {
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) {
            return 1.0;
        }
        return 1.0 - (double) LEVENSHTEIN.apply(a, b) / longer;
    }
}
