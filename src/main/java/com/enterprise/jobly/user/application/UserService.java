package com.enterprise.jobly.user.application;

import com.enterprise.jobly.job.application.JobService;
import com.enterprise.jobly.shared.error.BadRequestException;
import com.enterprise.jobly.shared.error.NotFoundException;
import com.enterprise.jobly.shared.querybridge.port.QueryExecutor;
import com.enterprise.jobly.shared.validation.FieldSchema;
import com.enterprise.jobly.sql.error.NoDataException;
import com.enterprise.jobly.user.domain.User;
import com.enterprise.jobly.user.domain.UserDetail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * User records and job applications. Registration and credentials live elsewhere.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final FieldSchema UPDATABLE = FieldSchema.builder()
        .required("firstName", String.class)
        .required("lastName", String.class)
        .required("email", String.class)
        .required("isAdmin", Boolean.class)
        .build();

    private final QueryExecutor executor;
    private final JobService jobs;

    public UserService(QueryExecutor executor, JobService jobs) {
        this.executor = executor;
        this.jobs = jobs;
    }

    /** All users, ordered by username. */
    public List<User> findAll() {
        return executor.query(UserQueries.all(), UserQueries.rowMapper());
    }

    /**
     * @throws NotFoundException if no user has this username
     */
    public UserDetail get(String username) {
        User user = find(username);
        List<Integer> jobIds = executor.query(UserQueries.appliedJobIds(username), UserQueries.jobIdRowMapper());
        return UserDetail.of(user, jobIds);
    }

    /**
     * Partial update; only the supplied fields change.
     *
     * @param data any of {@code firstName}, {@code lastName}, {@code email}, {@code isAdmin}
     * @throws NoDataException     if {@code data} is empty
     * @throws BadRequestException if {@code data} holds another field or a mistyped value
     * @throws NotFoundException   if no user has this username
     */
    public User update(String username, Map<String, ?> data) {
        int rows = executor.update(UserQueries.update(username, UPDATABLE.check(data)));
        if (rows == 0) {
            throw new NotFoundException("No user: " + username);
        }
        log.info("Updated user {} fields {}", username, data.keySet());
        return find(username);
    }

    /**
     * @throws NotFoundException if no user has this username
     */
    public void remove(String username) {
        if (executor.update(UserQueries.delete(username)) == 0) {
            throw new NotFoundException("No user: " + username);
        }
        log.info("Deleted user {}", username);
    }

    /**
     * Records that {@code username} applied to job {@code jobId}.
     *
     * @throws NotFoundException   if the user or the job does not exist
     * @throws BadRequestException if the user already applied to this job
     */
    public void applyToJob(String username, int jobId) {
        find(username);
        jobs.find(jobId);
        if (executor.queryFirst(UserQueries.application(username, jobId), UserQueries.jobIdRowMapper()).isPresent()) {
            throw new BadRequestException("Already applied: " + username + " to job " + jobId);
        }
        executor.update(UserQueries.insertApplication(username, jobId));
        log.info("User {} applied to job {}", username, jobId);
    }

    private User find(String username) {
        return executor.queryFirst(UserQueries.byUsername(username), UserQueries.rowMapper())
            .orElseThrow(() -> new NotFoundException("No user: " + username));
    }
}
