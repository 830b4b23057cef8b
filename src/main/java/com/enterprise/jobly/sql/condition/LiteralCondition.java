package com.enterprise.jobly.sql.condition;

import com.enterprise.jobly.sql.param.ParameterBinder;
import com.enterprise.jobly.sql.validation.ExpressionValidator;

/**
 * Fixed predicate text that binds nothing, e.g. {@code equity > 0}.
 * The binder is left untouched, so following placeholders keep their numbering.
 */
public class LiteralCondition implements Condition {

    private final String sql;

    public LiteralCondition(String sql) {
        ExpressionValidator.validateExpression(sql);
        this.sql = sql;
    }

    @Override
    public String toSql(ParameterBinder binder) {
        return sql;
    }
}
