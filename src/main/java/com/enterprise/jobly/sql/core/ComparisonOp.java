package com.enterprise.jobly.sql.core;

public enum ComparisonOp {
    EQ("="), GT(">"), GTE(">="), LTE("<=");

    private final String sql;

    ComparisonOp(String sql) { this.sql = sql; }

    public String sql() { return sql; }
}
