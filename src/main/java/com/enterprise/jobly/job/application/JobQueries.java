package com.enterprise.jobly.job.application;

import com.enterprise.jobly.job.domain.Job;
import com.enterprise.jobly.job.domain.JobSummary;
import com.enterprise.jobly.sql.builder.DeleteBuilder;
import com.enterprise.jobly.sql.builder.FilterQueryBuilder;
import com.enterprise.jobly.sql.builder.InsertBuilder;
import com.enterprise.jobly.sql.builder.PartialUpdateBuilder;
import com.enterprise.jobly.sql.builder.SelectBuilder;
import com.enterprise.jobly.sql.builder.SqlResult;
import com.enterprise.jobly.sql.builder.UpdateBuilder;
import com.enterprise.jobly.sql.filter.FilterPredicate;
import com.enterprise.jobly.sql.filter.FilterVocabulary;

import org.springframework.jdbc.core.RowMapper;

import java.util.Map;

import static com.enterprise.jobly.job.domain.JobTable.JOBS;
import static com.enterprise.jobly.sql.condition.Conditions.eq;

public final class JobQueries {

    private JobQueries() {}

    public static final FilterVocabulary FILTERS = FilterVocabulary.builder()
        .rule("title", JOBS.TITLE, FilterPredicate.CONTAINS_IGNORE_CASE)
        .rule("minSalary", JOBS.SALARY, FilterPredicate.AT_LEAST)
        .rule("hasEquity", JOBS.EQUITY, FilterPredicate.POSITIVE_FLAG)
        .build();

    public static final FilterQueryBuilder SEARCH =
        new FilterQueryBuilder(JOBS, FILTERS, JOBS.TITLE);

    public static SqlResult search(Map<String, ?> filters) {
        return SEARCH.build(filters);
    }

    public static SqlResult byId(int id) {
        return SelectBuilder.query()
            .select(JOBS.projection())
            .from(JOBS)
            .where(eq(JOBS.ID, id))
            .build();
    }

    public static SqlResult byCompany(String companyHandle) {
        return SelectBuilder.query()
            .select(JOBS.ID.projection(), JOBS.TITLE.projection(),
                    JOBS.SALARY.projection(), JOBS.EQUITY.projection())
            .from(JOBS)
            .where(eq(JOBS.COMPANY_HANDLE, companyHandle))
            .orderBy(JOBS.ID)
            .build();
    }

    public static SqlResult insert(Job job) {
        return InsertBuilder.insert()
            .into(JOBS)
            .set(JOBS.TITLE, job.title())
            .setIfPresent(JOBS.SALARY, job.salary())
            .setIfPresent(JOBS.EQUITY, job.equity())
            .set(JOBS.COMPANY_HANDLE, job.companyHandle())
            .build();
    }

    public static SqlResult update(int id, Map<String, ?> data) {
        return UpdateBuilder.update()
            .table(JOBS)
            .set(PartialUpdateBuilder.sqlForPartialUpdate(data, JOBS.translation()))
            .where(eq(JOBS.ID, id))
            .build();
    }

    public static SqlResult delete(int id) {
        return DeleteBuilder.delete()
            .from(JOBS)
            .where(eq(JOBS.ID, id))
            .build();
    }

    public static RowMapper<Job> rowMapper() {
        return (rs, rowNum) -> new Job(
            rs.getInt("id"),
            rs.getString("title"),
            rs.getObject("salary", Integer.class),
            rs.getBigDecimal("equity"),
            rs.getString("companyHandle"));
    }

    public static RowMapper<JobSummary> summaryRowMapper() {
        return (rs, rowNum) -> new JobSummary(
            rs.getInt("id"),
            rs.getString("title"),
            rs.getObject("salary", Integer.class),
            rs.getBigDecimal("equity"));
    }
}
