package com.enterprise.jobly.company;

import com.enterprise.jobly.company.application.CompanyService;
import com.enterprise.jobly.company.domain.Company;
import com.enterprise.jobly.company.domain.CompanyDetail;
import com.enterprise.jobly.job.domain.JobSummary;
import com.enterprise.jobly.shared.error.BadRequestException;
import com.enterprise.jobly.shared.error.NotFoundException;
import com.enterprise.jobly.sql.error.NoDataException;
import com.enterprise.jobly.sql.error.UnrecognizedFilterKeyException;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Company operations against the seeded H2 database. Each test rolls back.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Transactional
public class CompanyServiceTest {

    @Autowired
    private CompanyService companies;

    // ==================== create ====================

    @Test
    void testCreate() {
        Company created = companies.create(new Company("new", "New", "New Description", 50, "http://new.img"));

        assertThat(created).isEqualTo(new Company("new", "New", "New Description", 50, "http://new.img"));
        assertThat(companies.find("new")).isEqualTo(created);
    }

    @Test
    void testCreateWithoutOptionalFields() {
        Company created = companies.create(new Company("bare", "Bare", "Nothing else", null, null));
        assertThat(created.numEmployees()).isNull();
        assertThat(created.logoUrl()).isNull();
    }

    @Test
    void testCreateDuplicate() {
        assertThatThrownBy(() -> companies.create(new Company("c1", "Other", "Desc", null, null)))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Duplicate company: c1");
    }

    // ==================== findAll ====================

    @Test
    void testFindAllUnfiltered() {
        assertThat(companies.findAll(Map.of()))
                .extracting(Company::handle)
                .containsExactly("c1", "c2", "c3");
    }

    @Test
    void testFindAllByRange() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("minEmployees", 2);
        filters.put("maxEmployees", 3);

        assertThat(companies.findAll(filters))
                .extracting(Company::handle)
                .containsExactly("c2", "c3");
    }

    @Test
    void testFindAllByNameIgnoresCase() {
        assertThat(companies.findAll(Map.of("name", "c1")))
                .extracting(Company::handle)
                .containsExactly("c1");
    }

    @Test
    void testFindAllInvertedRangeIsEmpty() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("minEmployees", 3);
        filters.put("maxEmployees", 2);
        assertThat(companies.findAll(filters)).isEmpty();
    }

    @Test
    void testFindAllUnknownFilter() {
        assertThatThrownBy(() -> companies.findAll(Map.of("fakeQueryField", "x")))
                .isInstanceOf(UnrecognizedFilterKeyException.class);
    }

    // ==================== get ====================

    @Test
    void testGetAttachesJobs() {
        CompanyDetail detail = companies.get("c1");

        assertThat(detail.handle()).isEqualTo("c1");
        assertThat(detail.numEmployees()).isEqualTo(1);
        assertThat(detail.jobs()).extracting(JobSummary::title).containsExactly("job 1", "job 2");
    }

    @Test
    void testGetNotFound() {
        assertThatThrownBy(() -> companies.get("nope"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("No company: nope");
    }

    // ==================== update ====================

    @Test
    void testUpdateTranslatedAndVerbatimFields() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "New");
        data.put("numEmployees", 10);
        data.put("logoUrl", "http://new.img");

        Company updated = companies.update("c1", data);
        assertThat(updated).isEqualTo(new Company("c1", "New", "Desc1", 10, "http://new.img"));
    }

    @Test
    void testUpdateToNull() {
        Map<String, Object> data = new HashMap<>();
        data.put("numEmployees", null);
        data.put("logoUrl", null);

        Company updated = companies.update("c1", data);
        assertThat(updated.numEmployees()).isNull();
        assertThat(updated.logoUrl()).isNull();
        assertThat(updated.name()).isEqualTo("C1");
    }

    @Test
    void testUpdateLeavesOtherRowsAlone() {
        companies.update("c1", Map.of("description", "Changed"));
        assertThat(companies.find("c2").description()).isEqualTo("Desc2");
    }

    @Test
    void testUpdateToTakenNameFailsInStore() {
        assertThatThrownBy(() -> companies.update("c1", Map.of("name", "C2")))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThat(companies.find("c1").name()).isEqualTo("C1");
    }

    @Test
    void testUpdateNoData() {
        assertThatThrownBy(() -> companies.update("c1", Map.of()))
                .isInstanceOf(NoDataException.class);
    }

    @Test
    void testUpdateRejectsHandle() {
        assertThatThrownBy(() -> companies.update("c1", Map.of("handle", "c9")))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void testUpdateNotFound() {
        assertThatThrownBy(() -> companies.update("nope", Map.of("name", "x")))
                .isInstanceOf(NotFoundException.class);
    }

    // ==================== remove ====================

    @Test
    void testRemove() {
        companies.remove("c1");
        assertThatThrownBy(() -> companies.find("c1")).isInstanceOf(NotFoundException.class);
        assertThat(companies.findAll(Map.of())).hasSize(2);
    }

    @Test
    void testRemoveNotFound() {
        assertThatThrownBy(() -> companies.remove("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void testFindAllReturnsList() {
        List<Company> all = companies.findAll(Map.of("name", "zzz"));
        assertThat(all).isEmpty();
    }
}
