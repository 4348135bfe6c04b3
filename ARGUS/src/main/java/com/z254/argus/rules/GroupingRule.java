package com.z254.argus.rules;

import com.z254.argus.domain.model.Alert;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;

/**
 * Declarative grouping policy for a service.
 */
@Value
@Builder
public class GroupingRule {

    String name;
    int priority;

    @Singular
    List<RuleCondition> conditions;

    @Builder.Default
    RuleLogic logic = RuleLogic.AND;

    @Singular
    List<String> groupingKeys;

    double similarityThreshold;
    Duration timeWindow;

    /**
     * Rules with a condition whose operator cannot be parsed are skipped.
     */
    public boolean isEvaluable() {
        return conditions.stream().allMatch(RuleCondition::isParseable);
    }

    public boolean matches(Alert alert) {
        if (!isEvaluable()) {
            return false;
        }
        if (logic == RuleLogic.AND) {
            return conditions.stream().allMatch(condition -> condition.evaluate(alert));
        }
        return conditions.stream().anyMatch(condition -> condition.evaluate(alert));
    }

    /**
     * Group key built from the resolved grouping keys joined with {@code :};
     * unresolved keys contribute {@code unknown}.
     */
    public String groupKey(Alert alert) {
        StringJoiner joiner = new StringJoiner(":");
        for (String key : groupingKeys) {
            joiner.add(FieldResolver.resolve(alert, key)
                    .map(String::valueOf)
                    .orElse("unknown"));
        }
        return joiner.toString();
    }
}
