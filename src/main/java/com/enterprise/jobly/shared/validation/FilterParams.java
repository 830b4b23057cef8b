package com.enterprise.jobly.shared.validation;

import com.enterprise.jobly.shared.error.BadRequestException;
import com.enterprise.jobly.sql.filter.FilterVocabulary;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts query-string filters to the value types of a {@link FilterVocabulary}.
 */
public final class FilterParams {

    private FilterParams() {}

    /**
     * Coerces each recognized key's text to its rule's value type, keeping query order.
     * Unrecognized keys are passed through unchanged; the filter builder rejects them by name.
     *
     * @throws BadRequestException if a recognized key carries a malformed value
     */
    public static Map<String, Object> coerce(FilterVocabulary vocabulary, Map<String, String> params) {
        Map<String, Object> filters = new LinkedHashMap<>();
        for (Map.Entry<String, String> param : params.entrySet()) {
            String key = param.getKey();
            if (!vocabulary.recognizes(key)) {
                filters.put(key, param.getValue());
                continue;
            }
            try {
                filters.put(key, ValueCoercer.coerce(param.getValue(), vocabulary.rule(key).valueType()));
            } catch (IllegalArgumentException e) {
                throw new BadRequestException("Invalid value for " + key + ": " + e.getMessage(), e);
            }
        }
        return filters;
    }
}
