package com.enterprise.jobly.sql.condition;

import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.param.ParameterBinder;

import java.util.Objects;

/**
 * {@code col ILIKE '%' || $n || '%' ESCAPE '\'}. The search text is matched as a literal
 * substring: {@code %}, {@code _} and {@code \} in it are escaped before binding, and the
 * surrounding wildcards are added by the database, never concatenated in Java.
 */
public class ContainsCondition implements Condition {

    private static final char ESCAPE = '\\';

    private final Column<?> column;
    private final String text;

    public ContainsCondition(Column<?> column, Object text) {
        Objects.requireNonNull(column);
        Objects.requireNonNull(text, "Search text must not be null");
        this.column = column;
        this.text = escapeWildcards(text.toString());
    }

    @Override
    public String toSql(ParameterBinder binder) {
        String param = binder.bind(text);
        return column.ref() + " ILIKE '%' || " + param + " || '%' ESCAPE '" + ESCAPE + "'";
    }

    static String escapeWildcards(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == ESCAPE || c == '%' || c == '_') {
                escaped.append(ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
