package com.z254.argus.rules;

import com.z254.argus.domain.model.Alert;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A single {@code field operator value} test.
 * <p>
 * Evaluation never throws. An unresolved field, an unknown operator or a
 * type mismatch all evaluate to {@code false}.
 */
@Getter
public class RuleCondition {

    private final String field;
    private final String operatorToken;
    private final Object value;
    private final ConditionOperator operator;
    private final Pattern pattern;

    public RuleCondition(String field, String operatorToken, Object value) {
        this.field = field;
        this.operatorToken = operatorToken;
        this.value = value;
        this.operator = ConditionOperator.fromToken(operatorToken).orElse(null);
        this.pattern = operator == ConditionOperator.MATCHES ? compile(value) : null;
    }

    /**
     * Whether the operator is known; conditions with unknown operators make
     * the owning rule unevaluable.
     */
    public boolean isParseable() {
        return operator != null;
    }

    /**
     * Whether a {@code matches} condition carries a pattern that failed to compile.
     */
    public boolean hasInvalidPattern() {
        return operator == ConditionOperator.MATCHES && pattern == null;
    }

    public boolean evaluate(Alert alert) {
        if (operator == null) {
            return false;
        }
        Optional<Object> resolved = FieldResolver.resolve(alert, field);
        if (resolved.isEmpty()) {
            return false;
        }
        Object actual = normalize(resolved.get());

        switch (operator) {
            case EQ:
                return valuesEqual(actual, value);
            case NE:
                return !valuesEqual(actual, value);
            case GT:
                return compare(actual, value).map(c -> c > 0).orElse(false);
            case GTE:
                return compare(actual, value).map(c -> c >= 0).orElse(false);
            case LT:
                return compare(actual, value).map(c -> c < 0).orElse(false);
            case LTE:
                return compare(actual, value).map(c -> c <= 0).orElse(false);
            case IN:
                return contains(value, actual).orElse(false);
            case NOT_IN:
                return contains(value, actual).map(found -> !found).orElse(false);
            case CONTAINS:
                return value != null && String.valueOf(actual).contains(String.valueOf(value));
            case MATCHES:
                return pattern != null && pattern.matcher(String.valueOf(actual)).lookingAt();
            default:
                return false;
        }
    }

    private static Object normalize(Object actual) {
        if (actual instanceof Instant) {
            return ((Instant) actual).getEpochSecond();
        }
        return actual;
    }

    static boolean valuesEqual(Object actual, Object expected) {
        Optional<BigDecimal> a = asNumber(actual);
        Optional<BigDecimal> b = asNumber(expected);
        if (a.isPresent() && b.isPresent()) {
            return a.get().compareTo(b.get()) == 0;
        }
        if (actual == null || expected == null) {
            return Objects.equals(actual, expected);
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    private static Optional<Integer> compare(Object actual, Object expected) {
        Optional<BigDecimal> a = asNumber(actual);
        Optional<BigDecimal> b = asNumber(expected);
        if (a.isPresent() && b.isPresent()) {
            return Optional.of(a.get().compareTo(b.get()));
        }
        if (actual instanceof String && expected instanceof String) {
            return Optional.of(((String) actual).compareTo((String) expected));
        }
        return Optional.empty();
    }

    private static Optional<Boolean> contains(Object container, Object actual) {
        if (container instanceof Collection) {
            for (Object candidate : (Collection<?>) container) {
                if (valuesEqual(actual, candidate)) {
                    return Optional.of(true);
                }
            }
            return Optional.of(false);
        }
        if (container instanceof String) {
            return Optional.of(((String) container).contains(String.valueOf(actual)));
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> asNumber(Object value) {
        if (value instanceof Number) {
            try {
                return Optional.of(new BigDecimal(value.toString()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(text));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Pattern compile(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Pattern.compile(String.valueOf(value));
        } catch (PatternSyntaxException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return field + " " + operatorToken + " " + value;
    }
}
