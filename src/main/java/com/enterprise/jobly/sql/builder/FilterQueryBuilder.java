package com.enterprise.jobly.sql.builder;

import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.core.Table;
import com.enterprise.jobly.sql.error.UnrecognizedFilterKeyException;
import com.enterprise.jobly.sql.filter.FilterVocabulary;

import java.util.Map;
import java.util.Objects;

/**
 * Builds a resource's search query from client-supplied filters.
 *
 * <p>The statement selects the table's public projection, adds one AND-ed predicate
 * per filter entry (in the map's iteration order) and ends with a fixed ORDER BY.
 * Filter values are always bound; only column names and literal predicate text
 * appear inline.
 *
 * <p>Example, with the jobs vocabulary:
 * <pre>{@code
 * SqlResult r = JobQueries.SEARCH.build(Map.of("title", "test", "minSalary", 80000));
 * // SELECT id, title, salary, equity, company_handle AS "companyHandle" FROM jobs
 * //   WHERE title ILIKE '%' || $1 || '%' ESCAPE '\' AND salary >= $2 ORDER BY title
 * }</pre>
 *
 * <p>Instances are immutable and safe to share.
 */
public final class FilterQueryBuilder {

    private final Table table;
    private final FilterVocabulary vocabulary;
    private final Column<?> sortKey;

    public FilterQueryBuilder(Table table, FilterVocabulary vocabulary, Column<?> sortKey) {
        this.table = Objects.requireNonNull(table, "table");
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.sortKey = Objects.requireNonNull(sortKey, "sortKey");
    }

    /**
     * @param filters recognized filter key to value; may be empty
     * @throws UnrecognizedFilterKeyException if any key is outside the vocabulary,
     *                                        whatever the other keys are
     */
    public SqlResult build(Map<String, ?> filters) {
        Objects.requireNonNull(filters, "filters");
        vocabulary.checkKeys(filters.keySet());

        SelectBuilder query = SelectBuilder.query()
                .select(table.projection())
                .from(table);
        for (Map.Entry<String, ?> filter : filters.entrySet()) {
            query.where(vocabulary.rule(filter.getKey()).toCondition(filter.getValue()));
        }

        SqlResult result = query.orderBy(sortKey).build();
        result.verify();
        return result;
    }

    public FilterVocabulary vocabulary() {
        return vocabulary;
    }
}
