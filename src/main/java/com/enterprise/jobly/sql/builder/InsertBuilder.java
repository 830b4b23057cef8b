package com.enterprise.jobly.sql.builder;

import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.core.Table;
import com.enterprise.jobly.sql.param.ParameterBinder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fluent builder for single-row INSERT statements.
 *
 * <p>Example:
 * <pre>{@code
 * SqlResult r = InsertBuilder.insert()
 *     .into(JOBS)
 *     .set(JOBS.TITLE, "Engineer")
 *     .setIfPresent(JOBS.EQUITY, equity)
 *     .build();
 * // INSERT INTO jobs (title, equity) VALUES ($1, $2)
 * }</pre>
 */
public class InsertBuilder {

    private final ParameterBinder binder = new ParameterBinder();
    private Table table;
    private final List<InsertSetEntry> setClauses = new ArrayList<>();

    private InsertBuilder() {}

    public static InsertBuilder insert() {
        return new InsertBuilder();
    }

    public InsertBuilder into(Table table) {
        this.table = Objects.requireNonNull(table, "table");
        return this;
    }

    /**
     * Adds column = value. Value must not be null; use {@link #setIfPresent} for
     * nullable columns, which then take their database default.
     */
    public <T> InsertBuilder set(Column<T> column, T value) {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(value, "value for " + column.name() + " - use setIfPresent()");
        setClauses.add(new InsertSetEntry(column, value));
        return this;
    }

    /**
     * Adds column = value if value is non-null; skips the column otherwise.
     */
    public <T> InsertBuilder setIfPresent(Column<T> column, T value) {
        if (value != null) {
            setClauses.add(new InsertSetEntry(column, value));
        }
        return this;
    }

    public SqlResult build() {
        Objects.requireNonNull(table, "table required - call .into(Table)");
        if (setClauses.isEmpty()) {
            throw new IllegalStateException("No columns to insert");
        }

        String columns = setClauses.stream()
                .map(e -> e.column().name())
                .collect(Collectors.joining(", "));
        String values = setClauses.stream()
                .map(e -> binder.bind(e.value()))
                .collect(Collectors.joining(", "));
        return new SqlResult("INSERT INTO " + table.declaration()
                + " (" + columns + ") VALUES (" + values + ")", binder.getValues());
    }

    private record InsertSetEntry(Column<?> column, Object value) {}
}
