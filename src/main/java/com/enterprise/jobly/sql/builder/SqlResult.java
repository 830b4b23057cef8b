package com.enterprise.jobly.sql.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A statement with {@code $N} placeholders and the values bound to them, in index order.
 */
public class SqlResult {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\d+)");

    private final String sql;
    private final List<Object> values;

    public SqlResult(String sql, List<Object> values) {
        this.sql = sql;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public String sql() { return sql; }

    public List<Object> values() { return values; }

    /** Converts {@code $N} placeholders to JDBC {@code ?} markers, values in marker order. */
    public PositionalQuery toPositional() {
        Matcher m = PLACEHOLDER.matcher(sql);
        StringBuilder positional = new StringBuilder();
        List<Object> ordered = new ArrayList<>();
        while (m.find()) {
            ordered.add(valueAt(Integer.parseInt(m.group(1))));
            m.appendReplacement(positional, "?");
        }
        m.appendTail(positional);
        return new PositionalQuery(positional.toString(), ordered.toArray());
    }

    /** Returns the SQL with all parameter values inlined for debugging. */
    public String toDebugString() {
        Matcher m = PLACEHOLDER.matcher(sql);
        StringBuilder inlined = new StringBuilder();
        while (m.find()) {
            Object value = valueAt(Integer.parseInt(m.group(1)));
            String replacement = value instanceof String ? "'" + value + "'" : String.valueOf(value);
            m.appendReplacement(inlined, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(inlined);
        return inlined.toString();
    }

    /**
     * Verifies placeholders appear as $1..$n in order, with no gaps or reuse,
     * and that exactly n values were bound.
     */
    public void verify() {
        Matcher m = PLACEHOLDER.matcher(sql);
        int expected = 1;
        while (m.find()) {
            int index = Integer.parseInt(m.group(1));
            if (index != expected) {
                throw new IllegalStateException(
                        "Expected placeholder $" + expected + " but found $" + index + " in: " + sql);
            }
            expected++;
        }
        if (expected - 1 != values.size()) {
            throw new IllegalStateException(
                    "SQL has " + (expected - 1) + " placeholders but " + values.size() + " values were bound");
        }
    }

    private Object valueAt(int index) {
        if (index < 1 || index > values.size()) {
            throw new IllegalStateException(
                    "SQL references $" + index + " but only " + values.size() + " values were bound");
        }
        return values.get(index - 1);
    }

    @Override
    public String toString() {
        return sql + " " + values;
    }

    public record PositionalQuery(String sql, Object[] values) {}
}
