package com.enterprise.jobly.job.domain;

import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.core.Table;

import java.math.BigDecimal;

public final class JobTable extends Table {

    public static final JobTable JOBS = new JobTable();

    public final Column<Integer>    ID;
    public final Column<String>     TITLE;
    public final Column<Integer>    SALARY;
    public final Column<BigDecimal> EQUITY;
    public final Column<String>     COMPANY_HANDLE;

    private JobTable() {
        super("jobs");
        this.ID             = column("id", Integer.class);
        this.TITLE          = column("title", String.class);
        this.SALARY         = column("salary", Integer.class);
        this.EQUITY         = column("equity", BigDecimal.class);
        this.COMPANY_HANDLE = column("company_handle", "companyHandle", String.class);
    }
}
