package com.enterprise.jobly.sql.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The SET fragment of a single-row update and the values bound to it.
 * {@code values.get(i)} belongs to placeholder {@code $(i+1)}.
 *
 * @param setColumns assignments such as {@code "first_name"=$1, "age"=$2}
 * @param values     bound values in placeholder order; entries may be null
 */
public record PartialUpdate(String setColumns, List<Object> values) {

    public PartialUpdate {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /** Index of the first placeholder a caller may append, i.e. {@code values.size() + 1}. */
    public int nextIndex() {
        return values.size() + 1;
    }

    /** {@link #nextIndex()} rendered as a placeholder, e.g. "$3". */
    public String nextPlaceholder() {
        return "$" + nextIndex();
    }
}
