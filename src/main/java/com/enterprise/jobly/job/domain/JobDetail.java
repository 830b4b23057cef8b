package com.enterprise.jobly.job.domain;

import com.enterprise.jobly.company.domain.Company;

import java.math.BigDecimal;

/**
 * A job with its owning company attached.
 */
public record JobDetail(
    Integer id,
    String title,
    Integer salary,
    BigDecimal equity,
    Company company
) {

    public static JobDetail of(Job job, Company company) {
        return new JobDetail(job.id(), job.title(), job.salary(), job.equity(), company);
    }
}
