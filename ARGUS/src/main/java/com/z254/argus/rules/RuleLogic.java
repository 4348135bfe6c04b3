package com.z254.argus.rules;

import java.util.Locale;

/**
 * How a rule combines its conditions.
 */
public enum RuleLogic {
    AND, OR;

    public static RuleLogic parse(String value) {
        return RuleLogic.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
