package com.enterprise.jobly.job;

import com.enterprise.jobly.job.application.JobService;
import com.enterprise.jobly.job.domain.Job;
import com.enterprise.jobly.job.domain.JobDetail;
import com.enterprise.jobly.shared.error.BadRequestException;
import com.enterprise.jobly.shared.error.NotFoundException;
import com.enterprise.jobly.sql.error.NoDataException;
import com.enterprise.jobly.sql.error.UnrecognizedFilterKeyException;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
public class JobServiceTest {

    @Autowired
    private JobService jobs;

    // ==================== create ====================

    @Test
    void testCreate() {
        Job created = jobs.create(new Job(null, "Engineer", 100000, new BigDecimal("0.05"), "c2"));

        assertThat(created.id()).isNotNull();
        assertThat(created.title()).isEqualTo("Engineer");
        assertThat(created.salary()).isEqualTo(100000);
        assertThat(created.equity()).isEqualByComparingTo("0.05");
        assertThat(created.companyHandle()).isEqualTo("c2");
        assertThat(jobs.find(created.id())).isEqualTo(created);
    }

    @Test
    void testCreateUnknownCompany() {
        assertThatThrownBy(() -> jobs.create(new Job(null, "Engineer", null, null, "nope")))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("No company: nope");
    }

    // ==================== findAll ====================

    @Test
    void testFindAllOrderedByTitle() {
        assertThat(jobs.findAll(Map.of()))
                .extracting(Job::title)
                .containsExactly("job 1", "job 2", "test job 3", "test job 4", "test job 5");
    }

    @Test
    void testFindAllByTitleAndMinSalary() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("title", "TEST");
        filters.put("minSalary", 80000);

        assertThat(jobs.findAll(filters))
                .extracting(Job::title)
                .containsExactly("test job 4", "test job 5");
    }

    @Test
    void testFindAllTitleSalaryAndEquity() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("title", "test");
        filters.put("minSalary", 75000);
        filters.put("hasEquity", true);

        assertThat(jobs.findAll(filters))
                .extracting(Job::title)
                .containsExactly("test job 5");
    }

    @Test
    void testFindAllWithEquity() {
        assertThat(jobs.findAll(Map.of("hasEquity", true)))
                .extracting(Job::title)
                .containsExactly("job 2", "test job 5");
    }

    @Test
    void testFindAllEquityFalseIsUnfiltered() {
        assertThat(jobs.findAll(Map.of("hasEquity", false))).hasSize(5);
    }

    @Test
    void testFindAllAllFilters() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("title", "job");
        filters.put("minSalary", 55000);
        filters.put("hasEquity", true);

        assertThat(jobs.findAll(filters))
                .extracting(Job::title)
                .containsExactly("job 2", "test job 5");
    }

    @Test
    void testFindAllUnknownFilter() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("title", "job");
        filters.put("fakeQueryField", "x");

        assertThatThrownBy(() -> jobs.findAll(filters))
                .isInstanceOf(UnrecognizedFilterKeyException.class)
                .hasMessage("Invalid query string parameter: fakeQueryField");
    }

    @Test
    void testTitleFilterTreatsQuotesAsText() {
        assertThat(jobs.findAll(Map.of("title", "' OR '1'='1"))).isEmpty();
    }

    @Test
    void testTitleWildcardsMatchLiterally() {
        jobs.create(new Job(null, "50%_off", null, null, "c1"));

        assertThat(jobs.findAll(Map.of("title", "_"))).extracting(Job::title).containsExactly("50%_off");
        assertThat(jobs.findAll(Map.of("title", "%_"))).extracting(Job::title).containsExactly("50%_off");
        assertThat(jobs.findAll(Map.of("title", "50_"))).isEmpty();
    }

    // ==================== get ====================

    @Test
    void testGetAttachesCompany() {
        int id = jobs.findAll(Map.of("title", "job 2")).get(0).id();
        JobDetail detail = jobs.get(id);

        assertThat(detail.title()).isEqualTo("job 2");
        assertThat(detail.company().handle()).isEqualTo("c1");
        assertThat(detail.company().numEmployees()).isEqualTo(1);
    }

    @Test
    void testGetNotFound() {
        assertThatThrownBy(() -> jobs.get(0))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("No job: 0");
    }

    // ==================== update ====================

    @Test
    void testUpdate() {
        int id = jobs.findAll(Map.of("title", "job 1")).get(0).id();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", "Renamed");
        data.put("equity", 0.5);

        Job updated = jobs.update(id, data);
        assertThat(updated.title()).isEqualTo("Renamed");
        assertThat(updated.equity()).isEqualByComparingTo("0.5");
        assertThat(updated.salary()).isEqualTo(50000);
        assertThat(updated.companyHandle()).isEqualTo("c1");
    }

    @Test
    void testUpdateSalaryToNull() {
        int id = jobs.findAll(Map.of("title", "job 1")).get(0).id();
        Map<String, Object> data = new HashMap<>();
        data.put("salary", null);

        assertThat(jobs.update(id, data).salary()).isNull();
    }

    @Test
    void testUpdateRejectsCompanyHandle() {
        int id = jobs.findAll(Map.of("title", "job 1")).get(0).id();
        assertThatThrownBy(() -> jobs.update(id, Map.of("companyHandle", "c2")))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Field not allowed: companyHandle");
    }

    @Test
    void testUpdateNoData() {
        assertThatThrownBy(() -> jobs.update(1, Map.of())).isInstanceOf(NoDataException.class);
    }

    @Test
    void testUpdateNotFound() {
        assertThatThrownBy(() -> jobs.update(0, Map.of("title", "x")))
                .isInstanceOf(NotFoundException.class);
    }

    // ==================== remove ====================

    @Test
    void testRemove() {
        int id = jobs.findAll(Map.of("title", "job 1")).get(0).id();
        jobs.remove(id);
        assertThatThrownBy(() -> jobs.find(id)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void testRemoveNotFound() {
        assertThatThrownBy(() -> jobs.remove(0)).isInstanceOf(NotFoundException.class);
    }
}
