package com.voltageems.alarmsrv.model;

import java.time.Instant;

/**
 * Raw search parameters. {@code page} is 1-based.
 */
public record RuleSearchCriteria(
    String keyword,
    Integer warningLevel,
    Boolean enabled,
    Instant createdFrom,
    Instant createdTo,
    int page,
    int pageSize
) {}
