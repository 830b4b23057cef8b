package com.enterprise.jobly.company.domain;

public record Company(
    String handle,
    String name,
    String description,
    Integer numEmployees,
    String logoUrl
) {}
