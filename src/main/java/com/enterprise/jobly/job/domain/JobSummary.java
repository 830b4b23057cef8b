package com.enterprise.jobly.job.domain;

import java.math.BigDecimal;

/**
 * A job as listed under its company.
 */
public record JobSummary(
    Integer id,
    String title,
    Integer salary,
    BigDecimal equity
) {}
