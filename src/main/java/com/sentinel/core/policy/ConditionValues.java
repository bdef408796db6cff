package com.sentinel.core.policy;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Exact value comparison used by conditions. Numbers compare by numeric value
 * ({@code 5}, {@code 5L} and {@code 5.0} are equal); everything else by {@code equals}.
 */
final class ConditionValues {

    private ConditionValues() {}

    static boolean same(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return toBigDecimal(a).compareTo(toBigDecimal(e)) == 0;
        }
        if (actual instanceof Enum<?> a && expected instanceof String e) {
            return a.name().equals(e);
        }
        return Objects.equals(actual, expected);
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return new BigDecimal(n.toString());
    }
}
