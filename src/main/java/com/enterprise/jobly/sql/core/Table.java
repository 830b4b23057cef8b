package com.enterprise.jobly.sql.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for all table definitions. Each subclass represents a single DB table
 * and serves as the single source of truth for column names, client-facing names and types.
 *
 * <p>The public projection and the field translation table are both derived from the
 * column declarations, so a resource never states a column mapping twice.</p>
 *
 * <p>Example:
 * <pre>{@code
 * public final class CompanyTable extends Table {
 *     public static final CompanyTable COMPANIES = new CompanyTable();
 *
 *     public final Column<String> HANDLE;
 *     public final Column<Integer> NUM_EMPLOYEES;
 *
 *     private CompanyTable() {
 *         super("companies");
 *         this.HANDLE = column("handle", String.class);
 *         this.NUM_EMPLOYEES = column("num_employees", "numEmployees", Integer.class);
 *     }
 * }
 * }</pre>
 */
public abstract class Table {

    private final String tableName;
    private final List<Column<?>> columns = new ArrayList<>();

    protected Table(String tableName) {
        this.tableName = tableName;
    }

    /**
     * Creates a column whose external name equals its storage name.
     */
    protected <T> Column<T> column(String name, Class<T> type) {
        return column(name, name, type);
    }

    /**
     * Creates a column exposed to clients as {@code externalName}.
     * Must be called in the constructor, in projection order.
     */
    protected <T> Column<T> column(String name, String externalName, Class<T> type) {
        Column<T> col = new Column<>(name, externalName, type);
        columns.add(col);
        return col;
    }

    /**
     * Returns the table name for use in FROM / INTO / UPDATE clauses.
     */
    public String declaration() {
        return tableName;
    }

    /**
     * Select list of every declared column, aliased to its external name where it differs.
     */
    public String[] projection() {
        return columns.stream().map(Column::projection).toArray(String[]::new);
    }

    /**
     * External name to storage column, for translated columns only.
     */
    public Map<String, String> translation() {
        Map<String, String> translation = new LinkedHashMap<>();
        for (Column<?> col : columns) {
            if (col.isTranslated()) {
                translation.put(col.externalName(), col.name());
            }
        }
        return Collections.unmodifiableMap(translation);
    }

    @Override
    public String toString() {
        return declaration();
    }
}
