package org.boc.config;

/**
 * Configuration keys understood by {@link BocConfiguration}.
 */
public interface BocParams {

    String PREFIX = "boc.";

    // defaults for beliefs created without an explicit decay
    String DECAY_CURVE  = PREFIX + "decay.curve";
    String DECAY_RATE   = PREFIX + "decay.rate";
    // ISO-8601 duration, e.g. PT1H
    String DECAY_PERIOD = PREFIX + "decay.period";

    // share of a contradicting evidence's confidence taken off the belief
    String CONFLICT_PENALTY = PREFIX + "conflict.penalty";
    // multiplier when contradicting weight outweighs positive and negative weight together
    String CONFLICT_HIGH_FACTOR = PREFIX + "conflict.high.factor";
    // multiplier when there is some contradicting weight
    String CONFLICT_MODERATE_FACTOR = PREFIX + "conflict.moderate.factor";

    String DEFAULT_RESOURCE = "boc.properties";
}
