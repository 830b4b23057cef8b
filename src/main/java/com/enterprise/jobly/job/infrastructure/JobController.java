package com.enterprise.jobly.job.infrastructure;

import com.enterprise.jobly.job.application.JobQueries;
import com.enterprise.jobly.job.application.JobService;
import com.enterprise.jobly.job.domain.Job;
import com.enterprise.jobly.job.domain.JobDetail;
import com.enterprise.jobly.shared.validation.FilterParams;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService jobs;

    public JobController(JobService jobs) {
        this.jobs = jobs;
    }

    public record NewJobRequest(
        @NotBlank String title,
        @PositiveOrZero Integer salary,
        @DecimalMin("0") @DecimalMax("1") BigDecimal equity,
        @NotBlank String companyHandle
    ) {
        Job toJob() {
            return new Job(null, title, salary, equity, companyHandle);
        }
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Job> create(@Valid @RequestBody NewJobRequest request) {
        return Map.of("job", jobs.create(request.toJob()));
    }

    /** Query string: title, minSalary, hasEquity. */
    @GetMapping
    public Map<String, List<Job>> findAll(@RequestParam Map<String, String> params) {
        return Map.of("jobs", jobs.findAll(FilterParams.coerce(JobQueries.FILTERS, params)));
    }

    @GetMapping("/{id}")
    public Map<String, JobDetail> get(@PathVariable int id) {
        return Map.of("job", jobs.get(id));
    }

    @PatchMapping("/{id}")
    public Map<String, Job> update(@PathVariable int id, @RequestBody Map<String, Object> data) {
        return Map.of("job", jobs.update(id, data));
    }

    @DeleteMapping("/{id}")
    public Map<String, String> remove(@PathVariable int id) {
        jobs.remove(id);
        return Map.of("deleted", String.valueOf(id));
    }
}
