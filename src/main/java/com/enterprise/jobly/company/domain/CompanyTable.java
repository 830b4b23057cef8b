package com.enterprise.jobly.company.domain;

import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.core.Table;

public final class CompanyTable extends Table {

    public static final CompanyTable COMPANIES = new CompanyTable();

    public final Column<String>  HANDLE;
    public final Column<String>  NAME;
    public final Column<String>  DESCRIPTION;
    public final Column<Integer> NUM_EMPLOYEES;
    public final Column<String>  LOGO_URL;

    private CompanyTable() {
        super("companies");
        this.HANDLE        = column("handle", String.class);
        this.NAME          = column("name", String.class);
        this.DESCRIPTION   = column("description", String.class);
        this.NUM_EMPLOYEES = column("num_employees", "numEmployees", Integer.class);
        this.LOGO_URL      = column("logo_url", "logoUrl", String.class);
    }
}
