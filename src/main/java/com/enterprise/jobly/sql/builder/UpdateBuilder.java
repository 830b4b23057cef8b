package com.enterprise.jobly.sql.builder;

import com.enterprise.jobly.sql.condition.Condition;
import com.enterprise.jobly.sql.core.Table;
import com.enterprise.jobly.sql.param.ParameterBinder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fluent builder for single-row UPDATE statements driven by a {@link PartialUpdate}.
 *
 * <p>The WHERE conditions continue the partial update's placeholder sequence, so a
 * SET fragment with n values is followed by {@code $(n+1)}.
 *
 * <p>{@link #build()} requires at least one WHERE condition.
 *
 * <p>Example:
 * <pre>{@code
 * PartialUpdate set = PartialUpdateBuilder.sqlForPartialUpdate(data, COMPANIES.translation());
 * SqlResult r = UpdateBuilder.update()
 *     .table(COMPANIES)
 *     .set(set)
 *     .where(eq(COMPANIES.HANDLE, handle))
 *     .build();
 * // UPDATE companies SET "name"=$1, "num_employees"=$2 WHERE handle = $3
 * }</pre>
 */
public class UpdateBuilder {

    private Table table;
    private PartialUpdate setClause;
    private final List<Condition> conditions = new ArrayList<>();

    private UpdateBuilder() {}

    public static UpdateBuilder update() {
        return new UpdateBuilder();
    }

    public UpdateBuilder table(Table table) {
        this.table = Objects.requireNonNull(table, "table");
        return this;
    }

    public UpdateBuilder set(PartialUpdate setClause) {
        this.setClause = Objects.requireNonNull(setClause, "setClause");
        return this;
    }

    /**
     * WHERE conditions. Nulls are silently filtered (same as SelectBuilder).
     */
    public UpdateBuilder where(Condition... conditions) {
        for (Condition c : conditions) {
            if (c != null) {
                this.conditions.add(c);
            }
        }
        return this;
    }

    /**
     * Builds UPDATE with mandatory WHERE. Throws if no conditions.
     */
    public SqlResult build() {
        Objects.requireNonNull(table, "table required - call .table(Table)");
        if (setClause == null) {
            throw new IllegalStateException("No SET clause - call .set(PartialUpdate)");
        }
        if (conditions.isEmpty()) {
            throw new IllegalStateException("WHERE required for UPDATE");
        }

        ParameterBinder binder = ParameterBinder.continuing(setClause.values());
        String where = conditions.stream()
                .map(c -> c.toSql(binder))
                .collect(Collectors.joining(" AND "));

        String sql = "UPDATE " + table.declaration()
                + " SET " + setClause.setColumns()
                + " WHERE " + where;
        return new SqlResult(sql, binder.getValues());
    }
}
