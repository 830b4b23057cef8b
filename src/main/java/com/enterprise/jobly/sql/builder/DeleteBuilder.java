package com.enterprise.jobly.sql.builder;

import com.enterprise.jobly.sql.condition.Condition;
import com.enterprise.jobly.sql.core.Table;
import com.enterprise.jobly.sql.param.ParameterBinder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fluent builder for DELETE statements.
 *
 * <p>{@link #build()} requires at least one WHERE condition.
 *
 * <p>Example:
 * <pre>{@code
 * SqlResult r = DeleteBuilder.delete()
 *     .from(JOBS)
 *     .where(eq(JOBS.ID, 7))
 *     .build();
 * }</pre>
 */
public class DeleteBuilder {

    private final ParameterBinder binder = new ParameterBinder();
    private Table table;
    private final List<Condition> conditions = new ArrayList<>();

    private DeleteBuilder() {}

    public static DeleteBuilder delete() {
        return new DeleteBuilder();
    }

    public DeleteBuilder from(Table table) {
        this.table = Objects.requireNonNull(table, "table");
        return this;
    }

    /**
     * WHERE conditions. Nulls are silently filtered.
     */
    public DeleteBuilder where(Condition... conditions) {
        for (Condition c : conditions) {
            if (c != null) {
                this.conditions.add(c);
            }
        }
        return this;
    }

    /**
     * Builds DELETE with mandatory WHERE. Throws if no conditions.
     */
    public SqlResult build() {
        Objects.requireNonNull(table, "table required - call .from(Table)");
        if (conditions.isEmpty()) {
            throw new IllegalStateException("WHERE required for DELETE");
        }

        String where = conditions.stream()
                .map(c -> c.toSql(binder))
                .collect(Collectors.joining(" AND "));
        return new SqlResult("DELETE FROM " + table.declaration() + " WHERE " + where,
                binder.getValues());
    }
}
