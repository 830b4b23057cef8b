package com.enterprise.jobly.sql.builder;

import com.enterprise.jobly.sql.condition.Condition;
import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.core.Table;
import com.enterprise.jobly.sql.param.ParameterBinder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fluent builder for single-table SELECT statements.
 * Produces {@link SqlResult} with {@code $N} positional parameters.
 *
 * <p>Unsupported: joins, GROUP BY / HAVING, LIMIT / OFFSET. Related rows are
 * fetched with a second query and attached by the caller.
 *
 * <p>Example:
 * <pre>{@code
 * import static com.enterprise.jobly.sql.condition.Conditions.*;
 * import static com.enterprise.jobly.job.domain.JobTable.JOBS;
 *
 * SqlResult result = SelectBuilder.query()
 *     .select(JOBS.projection())
 *     .from(JOBS)
 *     .where(eq(JOBS.ID, 7), isPositiveIf(JOBS.EQUITY, hasEquity))
 *     .orderBy(JOBS.TITLE)
 *     .build();
 * }</pre>
 */
public class SelectBuilder {

    private final ParameterBinder binder;

    private String selectClause;
    private String fromClause;

    // WHERE, rendered in insertion order so placeholder numbering follows it
    private final List<Condition> conditions = new ArrayList<>();

    private final List<String> orderByClauses = new ArrayList<>();

    private SelectBuilder(ParameterBinder binder) {
        this.binder = binder;
    }

    // ==================== Factory ====================

    /**
     * Creates a new SelectBuilder with a fresh ParameterBinder.
     */
    public static SelectBuilder query() {
        return new SelectBuilder(new ParameterBinder());
    }

    // ==================== SELECT / FROM ====================

    public SelectBuilder select(String... columns) {
        this.selectClause = String.join(", ", columns);
        return this;
    }

    public SelectBuilder from(Table table) {
        this.fromClause = table.declaration();
        return this;
    }

    // ==================== WHERE ====================

    /**
     * Adds WHERE conditions. Null conditions are silently filtered out,
     * enabling the "IfPresent" pattern from {@link com.enterprise.jobly.sql.condition.Conditions}.
     *
     * <p>All non-null conditions are combined with AND.</p>
     */
    public SelectBuilder where(Condition... conditions) {
        for (Condition c : conditions) {
            if (c != null) {
                this.conditions.add(c);
            }
        }
        return this;
    }

    // ==================== ORDER BY ====================

    public SelectBuilder orderBy(Column<?> column) {
        orderByClauses.add(column.ref());
        return this;
    }

    // ==================== BUILD ====================

    /**
     * Builds the final SQL query with positional parameters.
     * No conditions means no WHERE clause at all.
     */
    public SqlResult build() {
        Objects.requireNonNull(selectClause, "select list required - call .select(...)");
        Objects.requireNonNull(fromClause, "table required - call .from(Table)");

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(selectClause);
        sql.append(" FROM ").append(fromClause);

        if (!conditions.isEmpty()) {
            String whereClause = conditions.stream()
                    .map(c -> c.toSql(binder))
                    .collect(Collectors.joining(" AND "));
            sql.append(" WHERE ").append(whereClause);
        }

        if (!orderByClauses.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderByClauses));
        }

        return new SqlResult(sql.toString(), binder.getValues());
    }
}
