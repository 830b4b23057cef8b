package com.enterprise.jobly.shared.querybridge.port;

import com.enterprise.jobly.sql.builder.SqlResult;

import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;

/**
 * Runs statements produced by the SQL builders against the store.
 * Implementations verify each {@link SqlResult} before executing it.
 */
public interface QueryExecutor {

    <T> List<T> query(SqlResult query, RowMapper<T> rowMapper);

    /** First row of the result, or empty. */
    default <T> Optional<T> queryFirst(SqlResult query, RowMapper<T> rowMapper) {
        return query(query, rowMapper).stream().findFirst();
    }

    /** Executes INSERT / UPDATE / DELETE and returns the affected row count. */
    int update(SqlResult statement);

    /** Executes an INSERT and returns the value the store generated for {@code keyColumn}. */
    Number insertReturningKey(SqlResult statement, String keyColumn);
}
