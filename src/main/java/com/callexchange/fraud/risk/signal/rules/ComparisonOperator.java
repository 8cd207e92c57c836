package com.callexchange.fraud.risk.signal.rules;

import java.util.Collection;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Operators a {@link RuleCondition} can apply to a feature value.
 */
public enum ComparisonOperator {
    EQ, NE, GT, GTE, LT, LTE, CONTAINS, NOT_CONTAINS, REGEX, IN, NOT_IN;

    /**
     * @param actual   the feature value, may be null when the feature is absent
     * @param expected the configured operand
     */
    boolean test(Object actual, Object expected) {
        switch (this) {
            case EQ:
                return valueEquals(actual, expected);
            case NE:
                return !valueEquals(actual, expected);
            case GT:
                return comparable(actual, expected) && compare(actual, expected) > 0;
            case GTE:
                return comparable(actual, expected) && compare(actual, expected) >= 0;
            case LT:
                return comparable(actual, expected) && compare(actual, expected) < 0;
            case LTE:
                return comparable(actual, expected) && compare(actual, expected) <= 0;
            case CONTAINS:
                return actual != null && expected != null && actual.toString().contains(expected.toString());
            case NOT_CONTAINS:
                return actual == null || expected == null || !actual.toString().contains(expected.toString());
            case REGEX:
                return actual != null && expected != null
                        && Pattern.compile(expected.toString()).matcher(actual.toString()).find();
            case IN:
                return expected instanceof Collection && ((Collection<?>) expected).stream()
                        .anyMatch(candidate -> valueEquals(actual, candidate));
            case NOT_IN:
                return !(expected instanceof Collection) || ((Collection<?>) expected).stream()
                        .noneMatch(candidate -> valueEquals(actual, candidate));
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    private static boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue()) == 0;
        }
        if (actual != null && expected != null && !(actual.getClass().equals(expected.getClass()))) {
            return actual.toString().equalsIgnoreCase(expected.toString());
        }
        return Objects.equals(actual, expected);
    }

    /** Ordering operators only apply to numbers; anything else never matches. */
    private static boolean comparable(Object actual, Object expected) {
        return actual instanceof Number && expected instanceof Number;
    }

    private static int compare(Object actual, Object expected) {
        return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue());
    }
}
