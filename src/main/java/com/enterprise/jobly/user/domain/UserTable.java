package com.enterprise.jobly.user.domain;

import com.enterprise.jobly.sql.core.Column;
import com.enterprise.jobly.sql.core.Table;

/**
 * Public columns of {@code users}. The password hash is not declared,
 * so it never appears in a projection or a partial update.
 */
public final class UserTable extends Table {

    public static final UserTable USERS = new UserTable();

    public final Column<String>  USERNAME;
    public final Column<String>  FIRST_NAME;
    public final Column<String>  LAST_NAME;
    public final Column<String>  EMAIL;
    public final Column<Boolean> IS_ADMIN;

    private UserTable() {
        super("users");
        this.USERNAME   = column("username", String.class);
        this.FIRST_NAME = column("first_name", "firstName", String.class);
        this.LAST_NAME  = column("last_name", "lastName", String.class);
        this.EMAIL      = column("email", String.class);
        this.IS_ADMIN   = column("is_admin", "isAdmin", Boolean.class);
    }
}
