package com.enterprise.jobly.job.application;

import com.enterprise.jobly.company.application.CompanyService;
import com.enterprise.jobly.company.domain.Company;
import com.enterprise.jobly.job.domain.Job;
import com.enterprise.jobly.job.domain.JobDetail;
import com.enterprise.jobly.shared.error.BadRequestException;
import com.enterprise.jobly.shared.error.NotFoundException;
import com.enterprise.jobly.shared.querybridge.port.QueryExecutor;
import com.enterprise.jobly.shared.validation.FieldSchema;
import com.enterprise.jobly.sql.error.NoDataException;
import com.enterprise.jobly.sql.error.UnrecognizedFilterKeyException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Job records: create, search, fetch with company, partial update, delete.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    // id and companyHandle are fixed once a job exists
    static final FieldSchema UPDATABLE = FieldSchema.builder()
        .required("title", String.class)
        .nullable("salary", Integer.class)
        .nullable("equity", BigDecimal.class)
        .build();

    private final QueryExecutor executor;
    private final CompanyService companies;

    public JobService(QueryExecutor executor, CompanyService companies) {
        this.executor = executor;
        this.companies = companies;
    }

    /**
     * @param job job data; {@code id} is ignored and assigned by the store
     * @throws NotFoundException if {@code companyHandle} names no company
     */
    public Job create(Job job) {
        companies.find(job.companyHandle());
        int id = executor.insertReturningKey(JobQueries.insert(job), "id").intValue();
        log.info("Created job {} for company {}", id, job.companyHandle());
        return find(id);
    }

    /**
     * Jobs matching every filter, ordered by title.
     *
     * @param filters any of {@code title}, {@code minSalary}, {@code hasEquity}
     * @throws UnrecognizedFilterKeyException for any other key
     */
    public List<Job> findAll(Map<String, ?> filters) {
        return executor.query(JobQueries.search(filters), JobQueries.rowMapper());
    }

    /**
     * @throws NotFoundException if no job has this id
     */
    public JobDetail get(int id) {
        Job job = find(id);
        Company company = companies.find(job.companyHandle());
        return JobDetail.of(job, company);
    }

    /**
     * Partial update; only the supplied fields change.
     *
     * @param data any of {@code title}, {@code salary}, {@code equity}
     * @throws NoDataException     if {@code data} is empty
     * @throws BadRequestException if {@code data} holds another field or a mistyped value
     * @throws NotFoundException   if no job has this id
     */
    public Job update(int id, Map<String, ?> data) {
        int rows = executor.update(JobQueries.update(id, UPDATABLE.check(data)));
        if (rows == 0) {
            throw new NotFoundException("No job: " + id);
        }
        log.info("Updated job {} fields {}", id, data.keySet());
        return find(id);
    }

    /**
     * @throws NotFoundException if no job has this id
     */
    public void remove(int id) {
        if (executor.update(JobQueries.delete(id)) == 0) {
            throw new NotFoundException("No job: " + id);
        }
        log.info("Deleted job {}", id);
    }

    /**
     * @throws NotFoundException if no job has this id
     */
    public Job find(int id) {
        return executor.queryFirst(JobQueries.byId(id), JobQueries.rowMapper())
            .orElseThrow(() -> new NotFoundException("No job: " + id));
    }
}
