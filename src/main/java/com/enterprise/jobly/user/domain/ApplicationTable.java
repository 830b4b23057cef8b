package com.enterprise.jobly.user.domain;

import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.core.Table;

public final class ApplicationTable extends Table {

    public static final ApplicationTable APPLICATIONS = new ApplicationTable();

    public final Column<String>  USERNAME;
    public final Column<Integer> JOB_ID;

    private ApplicationTable() {
        super("applications");
        this.USERNAME = column("username", String.class);
        this.JOB_ID   = column("job_id", "jobId", Integer.class);
    }
}
