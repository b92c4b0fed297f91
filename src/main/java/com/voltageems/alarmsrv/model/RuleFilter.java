package com.voltageems.alarmsrv.model;

import com.voltageems.alarmsrv.enums.WarningLevel;
import java.time.Instant;

public record RuleFilter(
    String keyword,
    WarningLevel warningLevel,
    Boolean enabled,
    Instant createdFrom,
    Instant createdTo
) {}
