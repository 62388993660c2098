package com.meisai.mapping.matching;

import com.meisai.mapping.entity.MatchType;

import java.util.OptionalDouble;

/**
 * One way of recognising that a candidate describes the same toll usage as a statement record.
 * Strategies are independent of each other; an empty result means the strategy does not apply.
 */
public interface MatchStrategy {

    MatchType type();

    OptionalDouble score(MatchFields record, MatchFields candidate);
}
