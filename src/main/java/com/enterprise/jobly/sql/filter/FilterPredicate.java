package com.enterprise.jobly.sql.filter;

import com.enterprise.jobly.sql.condition.Condition;
import com.enterprise.jobly.sql.condition.Conditions;
import com.enterprise.jobly.sql.condition.ContainsCondition;
import com.enterprise.jobly.sql.condition.SimpleCondition;
import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.core.ComparisonOp;

/**
 * How a filter value restricts its column. Parameterized predicates bind the value;
 * the literal one renders fixed text and binds nothing.
 *
 * <p>A null value (or a false flag) yields no condition.
 */
public enum FilterPredicate {

    /** Case-insensitive substring match. */
    CONTAINS_IGNORE_CASE(true) {
        @Override
        Condition toCondition(Column<?> column, Object value) {
            return value == null ? null : new ContainsCondition(column, value);
        }
    },

    /** Inclusive lower bound. */
    AT_LEAST(true) {
        @Override
        Condition toCondition(Column<?> column, Object value) {
            return value == null ? null : new SimpleCondition(column, ComparisonOp.GTE, value);
        }
    },

    /** Inclusive upper bound. */
    AT_MOST(true) {
        @Override
        Condition toCondition(Column<?> column, Object value) {
            return value == null ? null : new SimpleCondition(column, ComparisonOp.LTE, value);
        }
    },

    /** {@code col > 0} when the flag is true. */
    POSITIVE_FLAG(false) {
        @Override
        @SuppressWarnings("unchecked")
        Condition toCondition(Column<?> column, Object value) {
            return Conditions.isPositiveIf((Column<? extends Number>) column, isTrue(value));
        }
    };

    private final boolean parameterized;

    FilterPredicate(boolean parameterized) {
        this.parameterized = parameterized;
    }

    /** Whether a present value consumes a placeholder. */
    public boolean parameterized() {
        return parameterized;
    }

    abstract Condition toCondition(Column<?> column, Object value);

    private static boolean isTrue(Object value) {
        return value instanceof Boolean b ? b : value != null && "true".equalsIgnoreCase(value.toString());
    }
}
