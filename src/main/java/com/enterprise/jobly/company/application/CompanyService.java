package com.enterprise.jobly.company.application;

import com.enterprise.jobly.company.domain.Company;
import com.enterprise.jobly.company.domain.CompanyDetail;
import com.enterprise.jobly.job.application.JobQueries;
import com.enterprise.jobly.job.domain.JobSummary;
import com.enterprise.jobly.shared.error.BadRequestException;
import com.enterprise.jobly.shared.error.NotFoundException;
import com.enterprise.jobly.shared.querybridge.port.QueryExecutor;
import com.enterprise.jobly.shared.validation.FieldSchema;
import com.enterprise.jobly.sql.error.NoDataException;
import com.enterprise.jobly.sql.error.UnrecognizedFilterKeyException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Company records: create, search, fetch with jobs, partial update, delete.
 */
@Service
public class CompanyService {

    private static final Logger log = LoggerFactory.getLogger(CompanyService.class);

    static final FieldSchema UPDATABLE = FieldSchema.builder()
        .required("name", String.class)
        .required("description", String.class)
        .nullable("numEmployees", Integer.class)
        .nullable("logoUrl", String.class)
        .build();

    private final QueryExecutor executor;

    public CompanyService(QueryExecutor executor) {
        this.executor = executor;
    }

    /**
     * @throws BadRequestException if the handle is already taken
     */
    public Company create(Company company) {
        if (executor.queryFirst(CompanyQueries.byHandle(company.handle()), CompanyQueries.rowMapper()).isPresent()) {
            throw new BadRequestException("Duplicate company: " + company.handle());
        }
        executor.update(CompanyQueries.insert(company));
        log.info("Created company {}", company.handle());
        return find(company.handle());
    }

    /**
     * Companies matching every filter, ordered by name.
     *
     * @param filters any of {@code name}, {@code minEmployees}, {@code maxEmployees}
     * @throws UnrecognizedFilterKeyException for any other key
     */
    public List<Company> findAll(Map<String, ?> filters) {
        return executor.query(CompanyQueries.search(filters), CompanyQueries.rowMapper());
    }

    /**
     * @throws NotFoundException if no company has this handle
     */
    public CompanyDetail get(String handle) {
        Company company = find(handle);
        List<JobSummary> jobs = executor.query(JobQueries.byCompany(handle), JobQueries.summaryRowMapper());
        return CompanyDetail.of(company, jobs);
    }

    /**
     * Partial update; only the supplied fields change.
     *
     * @param data any of {@code name}, {@code description}, {@code numEmployees}, {@code logoUrl}
     * @throws NoDataException     if {@code data} is empty
     * @throws BadRequestException if {@code data} holds another field or a mistyped value
     * @throws NotFoundException   if no company has this handle
     */
    public Company update(String handle, Map<String, ?> data) {
        int rows = executor.update(CompanyQueries.update(handle, UPDATABLE.check(data)));
        if (rows == 0) {
            throw new NotFoundException("No company: " + handle);
        }
        log.info("Updated company {} fields {}", handle, data.keySet());
        return find(handle);
    }

    /**
     * @throws NotFoundException if no company has this handle
     */
    public void remove(String handle) {
        if (executor.update(CompanyQueries.delete(handle)) == 0) {
            throw new NotFoundException("No company: " + handle);
        }
        log.info("Deleted company {}", handle);
    }

    /**
     * The company alone, without jobs attached.
     *
     * @throws NotFoundException if no company has this handle
     */
    public Company find(String handle) {
        return executor.queryFirst(CompanyQueries.byHandle(handle), CompanyQueries.rowMapper())
            .orElseThrow(() -> new NotFoundException("No company: " + handle));
    }
}
