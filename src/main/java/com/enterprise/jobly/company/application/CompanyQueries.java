package com.enterprise.jobly.company.application;

import com.enterprise.jobly.company.domain.Company;
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

import static com.enterprise.jobly.company.domain.CompanyTable.COMPANIES;
import static com.enterprise.jobly.sql.condition.Conditions.eq;

public final class CompanyQueries {

    private CompanyQueries() {}

    public static final FilterVocabulary FILTERS = FilterVocabulary.builder()
        .rule("name", COMPANIES.NAME, FilterPredicate.CONTAINS_IGNORE_CASE)
        .rule("minEmployees", COMPANIES.NUM_EMPLOYEES, FilterPredicate.AT_LEAST)
        .rule("maxEmployees", COMPANIES.NUM_EMPLOYEES, FilterPredicate.AT_MOST)
        .build();

    public static final FilterQueryBuilder SEARCH =
        new FilterQueryBuilder(COMPANIES, FILTERS, COMPANIES.NAME);

    public static SqlResult search(Map<String, ?> filters) {
        return SEARCH.build(filters);
    }

    public static SqlResult byHandle(String handle) {
        return SelectBuilder.query()
            .select(COMPANIES.projection())
            .from(COMPANIES)
            .where(eq(COMPANIES.HANDLE, handle))
            .build();
    }

    public static SqlResult insert(Company company) {
        return InsertBuilder.insert()
            .into(COMPANIES)
            .set(COMPANIES.HANDLE, company.handle())
            .set(COMPANIES.NAME, company.name())
            .set(COMPANIES.DESCRIPTION, company.description())
            .setIfPresent(COMPANIES.NUM_EMPLOYEES, company.numEmployees())
            .setIfPresent(COMPANIES.LOGO_URL, company.logoUrl())
            .build();
    }

    public static SqlResult update(String handle, Map<String, ?> data) {
        return UpdateBuilder.update()
            .table(COMPANIES)
            .set(PartialUpdateBuilder.sqlForPartialUpdate(data, COMPANIES.translation()))
            .where(eq(COMPANIES.HANDLE, handle))
            .build();
    }

    public static SqlResult delete(String handle) {
        return DeleteBuilder.delete()
            .from(COMPANIES)
            .where(eq(COMPANIES.HANDLE, handle))
            .build();
    }

    public static RowMapper<Company> rowMapper() {
        return (rs, rowNum) -> new Company(
            rs.getString("handle"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getObject("numEmployees", Integer.class),
            rs.getString("logoUrl"));
    }
}
