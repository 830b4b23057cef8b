package com.enterprise.jobly.sql.validation;

import java.util.regex.Pattern;

/**
 * SQL injection guard for builder-emitted text (column names, literal predicates).
 * Blocks DML keywords, comments, quotes and semicolons. Values are always parameterized.
 */
public final class ExpressionValidator {

    private ExpressionValidator() {}

    // Letter/underscore start, then alphanumeric/underscore; no dots, columns are unqualified
    private static final Pattern COLUMN_PATTERN =
            Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    // DML/DDL keywords that should never appear in expressions
    private static final Pattern DANGEROUS_KEYWORDS = Pattern.compile(
            "(?i)\\b(DROP|DELETE|INSERT|UPDATE|ALTER|CREATE|TRUNCATE|EXEC|EXECUTE|GRANT|REVOKE)\\b");

    // SQL comment markers
    private static final Pattern COMMENTS = Pattern.compile("(--|/\\*|\\*/)");

    /**
     * Validates a column name that will be emitted as a quoted identifier.
     * Keywords are fine here (quoting neutralises them); shape is what matters.
     */
    public static void validateColumnName(String column) {
        if (column == null || !COLUMN_PATTERN.matcher(column).matches()) {
            throw new IllegalArgumentException("Invalid column name: " + column);
        }
    }

    /** Validates a fixed SQL fragment such as a literal predicate. */
    public static void validateExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression cannot be null or blank");
        }
        if (DANGEROUS_KEYWORDS.matcher(expression).find()) {
            throw new IllegalArgumentException(
                    "Dangerous keyword in expression: " + expression);
        }
        if (COMMENTS.matcher(expression).find()) {
            throw new IllegalArgumentException(
                    "Comments not allowed in expression: " + expression);
        }
        if (expression.contains(";") || expression.contains("'") || expression.contains("\"")) {
            throw new IllegalArgumentException(
                    "Quotes and semicolons not allowed in expression: " + expression);
        }
    }
}
