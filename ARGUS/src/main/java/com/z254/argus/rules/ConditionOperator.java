package com.z254.argus.rules;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Comparison operators usable in rule conditions, with their symbolic aliases.
 */
public enum ConditionOperator {
    EQ("eq", "=="),
    NE("ne", "!="),
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    IN("in"),
    NOT_IN("not_in"),
    CONTAINS("contains"),
    MATCHES("matches");

    private static final Map<String, ConditionOperator> BY_TOKEN = new HashMap<>();

    static {
        for (ConditionOperator op : values()) {
            for (String token : op.tokens) {
                BY_TOKEN.put(token, op);
            }
        }
    }

    private final String[] tokens;

    ConditionOperator(String... tokens) {
        this.tokens = tokens;
    }

    public String token() {
        return tokens[0];
    }

    public static Optional<ConditionOperator> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TOKEN.get(token.trim().toLowerCase(Locale.ROOT)));
    }
}
