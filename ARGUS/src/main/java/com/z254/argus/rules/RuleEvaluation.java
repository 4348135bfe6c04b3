package com.z254.argus.rules;

import lombok.Value;

import java.time.Duration;
import java.util.Optional;

/**
 * Result of evaluating an alert against the rule set.
 */
@Value
public class RuleEvaluation {

    /** Name of the matching rule, {@code null} when the defaults applied */
    String matchingRule;
    String groupKey;
    double similarityThreshold;
    Duration timeWindow;
    int priority;

    public Optional<String> matchingRuleName() {
        return Optional.ofNullable(matchingRule);
    }
}
