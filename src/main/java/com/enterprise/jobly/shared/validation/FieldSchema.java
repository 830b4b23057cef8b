package com.enterprise.jobly.shared.validation;

import com.enterprise.jobly.shared.error.BadRequestException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields a resource accepts in a partial-update body, with their types.
 * Fields outside the schema (ids, owning keys, passwords) are rejected.
 */
public final class FieldSchema {

    private final Map<String, FieldSpec> fields;

    private FieldSchema(Map<String, FieldSpec> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy of {@code body} with values coerced to the declared types,
     * preserving the body's key order.
     *
     * @throws BadRequestException for unknown fields, bad types, or null in a non-nullable field
     */
    public Map<String, Object> check(Map<String, ?> body) {
        Map<String, Object> checked = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : body.entrySet()) {
            String name = entry.getKey();
            FieldSpec spec = fields.get(name);
            if (spec == null) {
                throw new BadRequestException("Field not allowed: " + name);
            }
            if (entry.getValue() == null && !spec.nullable()) {
                throw new BadRequestException("Field may not be null: " + name);
            }
            try {
                checked.put(name, ValueCoercer.coerce(entry.getValue(), spec.type()));
            } catch (IllegalArgumentException e) {
                throw new BadRequestException("Invalid value for " + name + ": " + e.getMessage(), e);
            }
        }
        return checked;
    }

    private record FieldSpec(Class<?> type, boolean nullable) {}

    public static final class Builder {

        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder required(String name, Class<?> type) {
            fields.put(name, new FieldSpec(type, false));
            return this;
        }

        public Builder nullable(String name, Class<?> type) {
            fields.put(name, new FieldSpec(type, true));
            return this;
        }

        public FieldSchema build() {
            return new FieldSchema(fields);
        }
    }
}
