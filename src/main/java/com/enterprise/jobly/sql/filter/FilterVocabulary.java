package com.enterprise.jobly.sql.filter;

import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.error.UnrecognizedFilterKeyException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The fixed set of filter keys a resource recognizes, each mapped to a {@link FilterRule}.
 * Immutable once built; shared by every request.
 *
 * <pre>{@code
 * FilterVocabulary jobs = FilterVocabulary.builder()
 *     .rule("title", JOBS.TITLE, FilterPredicate.CONTAINS_IGNORE_CASE)
 *     .rule("minSalary", JOBS.SALARY, FilterPredicate.AT_LEAST)
 *     .rule("hasEquity", JOBS.EQUITY, FilterPredicate.POSITIVE_FLAG)
 *     .build();
 * }</pre>
 */
public final class FilterVocabulary {

    private final Map<String, FilterRule> rules;

    private FilterVocabulary(Map<String, FilterRule> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean recognizes(String key) {
        return rules.containsKey(key);
    }

    /**
     * @throws UnrecognizedFilterKeyException if {@code key} is not part of this vocabulary
     */
    public FilterRule rule(String key) {
        FilterRule rule = rules.get(key);
        if (rule == null) {
            throw new UnrecognizedFilterKeyException(key);
        }
        return rule;
    }

    /**
     * Rejects the first key outside this vocabulary.
     *
     * @throws UnrecognizedFilterKeyException naming that key
     */
    public void checkKeys(Collection<String> keys) {
        for (String key : keys) {
            rule(key);
        }
    }

    public static final class Builder {

        private final Map<String, FilterRule> rules = new LinkedHashMap<>();

        private Builder() {}

        public Builder rule(String key, Column<?> column, FilterPredicate predicate) {
            if (rules.putIfAbsent(key, new FilterRule(column, predicate)) != null) {
                throw new IllegalArgumentException("Duplicate filter key: " + key);
            }
            return this;
        }

        public FilterVocabulary build() {
            return new FilterVocabulary(rules);
        }
    }
}
