package com.enterprise.jobly.shared.querybridge.adapter;

import com.enterprise.jobly.shared.querybridge.port.QueryExecutor;
import com.enterprise.jobly.sql.builder.SqlResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link QueryExecutor} over Spring's {@link JdbcTemplate}.
 *
 * <p>The DSL's {@code $N} placeholders are converted to JDBC {@code ?} markers via
 * {@link SqlResult#toPositional()} and bound with an {@link ArgumentPreparedStatementSetter}.
 * Connections and transactions stay with the {@code DataSource} behind the template.
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcQueryExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    }

    @Override
    public <T> List<T> query(SqlResult query, RowMapper<T> rowMapper) {
        SqlResult.PositionalQuery pq = resolve(query);
        return jdbcTemplate.query(pq.sql(), new ArgumentPreparedStatementSetter(pq.values()), rowMapper);
    }

    @Override
    public int update(SqlResult statement) {
        SqlResult.PositionalQuery pq = resolve(statement);
        return jdbcTemplate.update(pq.sql(), new ArgumentPreparedStatementSetter(pq.values()));
    }

    @Override
    public Number insertReturningKey(SqlResult statement, String keyColumn) {
        SqlResult.PositionalQuery pq = resolve(statement);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(pq.sql(), Statement.RETURN_GENERATED_KEYS);
            new ArgumentPreparedStatementSetter(pq.values()).setValues(ps);
            return ps;
        }, keyHolder);
        // drivers differ in how many columns they return; the key map is case-insensitive
        Map<String, Object> keys = keyHolder.getKeys();
        if (keys == null || !(keys.get(keyColumn) instanceof Number key)) {
            throw new DataRetrievalFailureException("No generated " + keyColumn + " returned for: " + pq.sql());
        }
        return key;
    }

    private SqlResult.PositionalQuery resolve(SqlResult result) {
        result.verify();
        if (log.isDebugEnabled()) {
            log.debug("Executing: {}", result.toDebugString());
        }
        return result.toPositional();
    }
}
