package com.enterprise.jobly.sql.param;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Binds values to positional parameters. {@link #bind(Object)} returns
 * {@code $N} (counter starts at 1) and stores the value at position N.
 * Placeholder index and value list share one counter, so there are no gaps.
 */
public class ParameterBinder {

    private final List<Object> values = new ArrayList<>();

    /**
     * Creates a binder whose first {@link #bind} returns {@code $(n+1)}, n being the
     * number of values already bound by an earlier fragment of the same statement.
     */
    public static ParameterBinder continuing(List<?> alreadyBound) {
        ParameterBinder binder = new ParameterBinder();
        binder.values.addAll(alreadyBound);
        return binder;
    }

    /**
     * Binds a value (null allowed) and returns its placeholder, e.g. "$3".
     */
    public String bind(Object value) {
        values.add(value);
        return "$" + values.size();
    }

    public List<Object> getValues() {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}
