package com.voltageems.alarmsrv.model;

import java.util.List;

public record RulePage(
    long total,
    int page,
    int pageSize,
    List<AlertRuleDto> items
) {}
