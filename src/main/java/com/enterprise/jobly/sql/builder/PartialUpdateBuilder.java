package com.enterprise.jobly.sql.builder;

import com.enterprise.jobly.sql.error.NoDataException;
import com.enterprise.jobly.sql.param.ParameterBinder;
import com.enterprise.jobly.sql.validation.ExpressionValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the SET fragment for a partial update from client field names.
 *
 * <p>Example:
 * <pre>{@code
 * PartialUpdate p = PartialUpdateBuilder.sqlForPartialUpdate(
 *     Map.of("firstName", "Aliya"), Map.of("firstName", "first_name"));
 * p.setColumns();      // "first_name"=$1
 * p.values();          // ["Aliya"]
 * p.nextPlaceholder(); // $2
 * }</pre>
 */
public final class PartialUpdateBuilder {

    private PartialUpdateBuilder() {}

    /**
     * One {@code "column"=$i} assignment per entry of {@code data}, in its iteration order.
     * The column is {@code translation.get(field)} or, absent an entry, the field name itself.
     *
     * @param data        field name to new value; must not be empty; null values set NULL
     * @param translation field name to column name; may be empty
     * @throws NoDataException          if {@code data} is empty
     * @throws IllegalArgumentException if a resolved column is not a plain identifier
     */
    public static PartialUpdate sqlForPartialUpdate(Map<String, ?> data,
                                                    Map<String, String> translation) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(translation, "translation");
        if (data.isEmpty()) {
            throw new NoDataException();
        }

        ParameterBinder binder = new ParameterBinder();
        List<String> assignments = new ArrayList<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String column = translation.getOrDefault(entry.getKey(), entry.getKey());
            ExpressionValidator.validateColumnName(column);
            assignments.add("\"" + column + "\"=" + binder.bind(entry.getValue()));
        }
        return new PartialUpdate(String.join(", ", assignments), binder.getValues());
    }
}
