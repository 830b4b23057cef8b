package com.enterprise.jobly.shared.querybridge.adapter;

import com.enterprise.jobly.shared.querybridge.port.QueryExecutor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the SQL DSL to the application's {@code DataSource}.
 *
 * <p>Override the bean to swap the executor, e.g. with a tracing decorator:
 * <pre>{@code
 * @Bean
 * public QueryExecutor queryExecutor(JdbcTemplate jdbcTemplate) {
 *     return new TracingQueryExecutor(new JdbcQueryExecutor(jdbcTemplate));
 * }
 * }</pre>
 */
@Configuration
public class QueryBridgeConfig {

    @Bean
    public QueryExecutor queryExecutor(JdbcTemplate jdbcTemplate) {
        return new JdbcQueryExecutor(jdbcTemplate);
    }
}
