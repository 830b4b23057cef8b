package com.enterprise.jobly.company.domain;

import com.enterprise.jobly.job.domain.JobSummary;

import java.util.List;

/**
 * A company with its jobs attached.
 */
public record CompanyDetail(
    String handle,
    String name,
    String description,
    Integer numEmployees,
    String logoUrl,
    List<JobSummary> jobs
) {

    public static CompanyDetail of(Company company, List<JobSummary> jobs) {
        return new CompanyDetail(company.handle(), company.name(), company.description(),
                company.numEmployees(), company.logoUrl(), List.copyOf(jobs));
    }
}
