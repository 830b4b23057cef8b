package com.enterprise.jobly.sql.filter;

import com.enterprise.jobly.sql.condition.Condition;
import com.enterprise.jobly.sql.core.Column;

import java.util.Objects;

/**
 * One entry of a filter vocabulary: the column a key restricts and how.
 */
public record FilterRule(Column<?> column, FilterPredicate predicate) {

    public FilterRule {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(predicate, "predicate");
        if (predicate == FilterPredicate.POSITIVE_FLAG && !Number.class.isAssignableFrom(column.type())) {
            throw new IllegalArgumentException(
                    "POSITIVE_FLAG needs a numeric column, got " + column.name());
        }
    }

    /**
     * Type a client value must have for this rule: the column's type for
     * parameterized predicates, {@link Boolean} for flags.
     */
    public Class<?> valueType() {
        return predicate.parameterized() ? column.type() : Boolean.class;
    }

    /** Condition for {@code value}, or null when it imposes no restriction. */
    public Condition toCondition(Object value) {
        return predicate.toCondition(column, value);
    }
}
