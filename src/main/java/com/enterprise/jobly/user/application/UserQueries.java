package com.enterprise.jobly.user.application;

import com.enterprise.jobly.sql.builder.DeleteBuilder;
import com.enterprise.jobly.sql.builder.InsertBuilder;
import com.enterprise.jobly.sql.builder.PartialUpdateBuilder;
import com.enterprise.jobly.sql.builder.SelectBuilder;
import com.enterprise.jobly.sql.builder.SqlResult;
import com.enterprise.jobly.sql.builder.UpdateBuilder;
import com.enterprise.jobly.user.domain.User;

import org.springframework.jdbc.core.RowMapper;

import java.util.Map;

import static com.enterprise.jobly.sql.condition.Conditions.eq;
import static com.enterprise.jobly.user.domain.ApplicationTable.APPLICATIONS;
import static com.enterprise.jobly.user.domain.UserTable.USERS;

public final class UserQueries {

    private UserQueries() {}

    public static SqlResult all() {
        return SelectBuilder.query()
            .select(USERS.projection())
            .from(USERS)
            .orderBy(USERS.USERNAME)
            .build();
    }

    public static SqlResult byUsername(String username) {
        return SelectBuilder.query()
            .select(USERS.projection())
            .from(USERS)
            .where(eq(USERS.USERNAME, username))
            .build();
    }

    public static SqlResult appliedJobIds(String username) {
        return SelectBuilder.query()
            .select(APPLICATIONS.JOB_ID.projection())
            .from(APPLICATIONS)
            .where(eq(APPLICATIONS.USERNAME, username))
            .orderBy(APPLICATIONS.JOB_ID)
            .build();
    }

    public static SqlResult application(String username, int jobId) {
        return SelectBuilder.query()
            .select(APPLICATIONS.projection())
            .from(APPLICATIONS)
            .where(eq(APPLICATIONS.USERNAME, username), eq(APPLICATIONS.JOB_ID, jobId))
            .build();
    }

    public static SqlResult insertApplication(String username, int jobId) {
        return InsertBuilder.insert()
            .into(APPLICATIONS)
            .set(APPLICATIONS.USERNAME, username)
            .set(APPLICATIONS.JOB_ID, jobId)
            .build();
    }

    public static SqlResult update(String username, Map<String, ?> data) {
        return UpdateBuilder.update()
            .table(USERS)
            .set(PartialUpdateBuilder.sqlForPartialUpdate(data, USERS.translation()))
            .where(eq(USERS.USERNAME, username))
            .build();
    }

    public static SqlResult delete(String username) {
        return DeleteBuilder.delete()
            .from(USERS)
            .where(eq(USERS.USERNAME, username))
            .build();
    }

    public static RowMapper<User> rowMapper() {
        return (rs, rowNum) -> new User(
            rs.getString("username"),
            rs.getString("firstName"),
            rs.getString("lastName"),
            rs.getString("email"),
            rs.getBoolean("isAdmin"));
    }

    public static RowMapper<Integer> jobIdRowMapper() {
        return (rs, rowNum) -> rs.getInt("jobId");
    }
}
