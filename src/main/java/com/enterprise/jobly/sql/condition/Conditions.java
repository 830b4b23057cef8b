package com.enterprise.jobly.sql.condition;

import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.core.ComparisonOp;

/**
 * Static factory for creating {@link Condition} instances.
 * Designed to be imported statically for a clean DSL.
 *
 * <pre>{@code
 * import static com.enterprise.jobly.sql.condition.Conditions.*;
 *
 * Condition byId = eq(JOBS.ID, 42);
 * Condition withEquity = isPositive(JOBS.EQUITY);
 *
 * // Optional condition (returns null when the flag is off, skipped by where(...))
 * Condition maybeEquity = isPositiveIf(JOBS.EQUITY, hasEquity);
 * }</pre>
 *
 * <p>Filter vocabularies build their conditions from a {@code FilterPredicate}
 * instead, since filter values arrive untyped.
 */
public final class Conditions {

    private Conditions() {}

    // ==================== Strict conditions (null -> exception) ====================

    public static <V> Condition eq(Column<V> column, V value) {
        return new SimpleCondition(column, ComparisonOp.EQ, value);
    }

    /** {@code col > 0} rendered inline; contributes no parameter. */
    public static Condition isPositive(Column<? extends Number> column) {
        return new LiteralCondition(column.ref() + " " + ComparisonOp.GT.sql() + " 0");
    }

    // ==================== Optional conditions (null -> return null) ====================

    /**
     * {@link #isPositive} when the flag is true; null otherwise, which
     * {@code where(Condition...)} filters out.
     */
    public static Condition isPositiveIf(Column<? extends Number> column, boolean flag) {
        return flag ? isPositive(column) : null;
    }
}
