package com.enterprise.jobly.sql;

import com.enterprise.jobly.sql.builder.DeleteBuilder;
import com.enterprise.jobly.sql.builder.InsertBuilder;
import com.enterprise.jobly.sql.builder.PartialUpdate;
import com.enterprise.jobly.sql.builder.PartialUpdateBuilder;
import com.enterprise.jobly.sql.builder.SelectBuilder;
import com.enterprise.jobly.sql.builder.SqlResult;
import com.enterprise.jobly.sql.builder.UpdateBuilder;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.enterprise.jobly.company.domain.CompanyTable.COMPANIES;
import static com.enterprise.jobly.job.domain.JobTable.JOBS;
import static com.enterprise.jobly.sql.condition.Conditions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * INSERT, UPDATE, DELETE and plain SELECT builders.
 */
public class DmlBuilderTests {

    // ==================== UpdateBuilder ====================

    @Test
    void testUpdateContinuesAfterSetValues() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", "New");
        data.put("numEmployees", 5);
        PartialUpdate set = PartialUpdateBuilder.sqlForPartialUpdate(data, COMPANIES.translation());

        SqlResult r = UpdateBuilder.update()
                .table(COMPANIES)
                .set(set)
                .where(eq(COMPANIES.HANDLE, "c1"))
                .build();

        assertThat(r.sql()).isEqualTo(
                "UPDATE companies SET \"name\"=$1, \"num_employees\"=$2 WHERE handle = $3");
        assertThat(r.values()).containsExactly("New", 5, "c1");
        assertThatCode(r::verify).doesNotThrowAnyException();
    }

    @Test
    void testUpdateMissingWhereThrows() {
        PartialUpdate set = PartialUpdateBuilder.sqlForPartialUpdate(Map.of("name", "x"), Map.of());
        assertThatThrownBy(() -> UpdateBuilder.update().table(COMPANIES).set(set).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("WHERE required");
    }

    @Test
    void testUpdateMissingSetThrows() {
        assertThatThrownBy(() -> UpdateBuilder.update()
                .table(COMPANIES)
                .where(eq(COMPANIES.HANDLE, "c1"))
                .build())
                .isInstanceOf(IllegalStateException.class);
    }

    // ==================== InsertBuilder ====================

    @Test
    void testInsertSkipsAbsentOptionalColumns() {
        SqlResult r = InsertBuilder.insert()
                .into(JOBS)
                .set(JOBS.TITLE, "Engineer")
                .setIfPresent(JOBS.SALARY, null)
                .setIfPresent(JOBS.EQUITY, new BigDecimal("0.5"))
                .set(JOBS.COMPANY_HANDLE, "c1")
                .build();

        assertThat(r.sql()).isEqualTo(
                "INSERT INTO jobs (title, equity, company_handle) VALUES ($1, $2, $3)");
        assertThat(r.values()).containsExactly("Engineer", new BigDecimal("0.5"), "c1");
    }

    @Test
    void testInsertSetRejectsNull() {
        assertThatThrownBy(() -> InsertBuilder.insert().into(JOBS).set(JOBS.TITLE, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("setIfPresent");
    }

    @Test
    void testInsertWithoutColumnsThrows() {
        assertThatThrownBy(() -> InsertBuilder.insert().into(JOBS).build())
                .isInstanceOf(IllegalStateException.class);
    }

    // ==================== DeleteBuilder ====================

    @Test
    void testDeleteBasic() {
        SqlResult r = DeleteBuilder.delete().from(JOBS).where(eq(JOBS.ID, 7)).build();

        assertThat(r.sql()).isEqualTo("DELETE FROM jobs WHERE id = $1");
        assertThat(r.values()).containsExactly(7);
    }

    @Test
    void testDeleteMissingWhereThrows() {
        assertThatThrownBy(() -> DeleteBuilder.delete().from(JOBS).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("WHERE required");
    }

    // ==================== SelectBuilder ====================

    @Test
    void testOptionalConditionSkipped() {
        SqlResult r = SelectBuilder.query()
                .select(JOBS.ID.ref())
                .from(JOBS)
                .where(isPositiveIf(JOBS.EQUITY, false), eq(JOBS.COMPANY_HANDLE, "c1"))
                .orderBy(JOBS.ID)
                .build();

        assertThat(r.sql()).isEqualTo("SELECT id FROM jobs WHERE company_handle = $1 ORDER BY id");
        assertThat(r.values()).containsExactly("c1");
    }

    @Test
    void testStrictConditionRejectsNull() {
        assertThatThrownBy(() -> eq(JOBS.TITLE, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("title");
    }
}
