package com.enterprise.jobly.shared.validation;

import java.math.BigDecimal;

/**
 * Converts loosely-typed client values (query-string text, JSON numbers) to the
 * Java type a column declares. Supports String, Integer, BigDecimal and Boolean.
 */
final class ValueCoercer {

    private ValueCoercer() {}

    /**
     * @throws IllegalArgumentException if {@code raw} cannot represent a {@code type}
     */
    static Object coerce(Object raw, Class<?> type) {
        if (raw == null || type.isInstance(raw)) {
            return raw;
        }
        if (type == Integer.class) {
            return toInteger(raw);
        }
        if (type == BigDecimal.class) {
            return toDecimal(raw);
        }
        if (type == Boolean.class && raw instanceof String s) {
            if ("true".equalsIgnoreCase(s)) return Boolean.TRUE;
            if ("false".equalsIgnoreCase(s)) return Boolean.FALSE;
        }
        throw new IllegalArgumentException("expected " + type.getSimpleName().toLowerCase());
    }

    private static Integer toInteger(Object raw) {
        try {
            BigDecimal decimal = toDecimal(raw);
            return decimal.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("expected integer", e);
        }
    }

    private static BigDecimal toDecimal(Object raw) {
        if (raw instanceof Number || raw instanceof String) {
            try {
                return new BigDecimal(raw.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("expected number", e);
            }
        }
        throw new IllegalArgumentException("expected number");
    }
}
