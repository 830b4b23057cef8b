package com.enterprise.jobly.sql.condition;

import com.enterprise.jobly.sql.param.ParameterBinder;

@FunctionalInterface
public interface Condition {
    String toSql(ParameterBinder binder);
}
