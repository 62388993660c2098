package com.meisai.mapping.matching;

import com.meisai.mapping.entity.MatchType;

import java.util.OptionalDouble;

public class ExactMatchStrategy implements MatchStrategy {

    @Override
    public MatchType type() {
        return MatchType.EXACT;
    }

    @Override
    public OptionalDouble score(MatchFields record, MatchFields candidate) {
        if (record.sameDate(candidate) && record.sameTime(candidate)
                && record.sameRoute(candidate) && record.sameAmount(candidate)) {
            return OptionalDouble.of(1.0);
        }
        return OptionalDouble.empty();
    }
}
