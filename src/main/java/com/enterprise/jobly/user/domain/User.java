package com.enterprise.jobly.user.domain;

public record User(
    String username,
    String firstName,
    String lastName,
    String email,
    Boolean isAdmin
) {}
