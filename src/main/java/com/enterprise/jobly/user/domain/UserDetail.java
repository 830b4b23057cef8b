package com.enterprise.jobly.user.domain;

import java.util.List;

/**
 * A user with the ids of the jobs they applied to.
 */
public record UserDetail(
    String username,
    String firstName,
    String lastName,
    String email,
    Boolean isAdmin,
    List<Integer> jobs
) {

    public static UserDetail of(User user, List<Integer> jobIds) {
        return new UserDetail(user.username(), user.firstName(), user.lastName(),
                user.email(), user.isAdmin(), List.copyOf(jobIds));
    }
}
