package com.voltageems.alarmsrv.model;

import com.voltageems.alarmsrv.enums.ComparisonOperator;
import com.voltageems.alarmsrv.enums.DataType;
import com.voltageems.alarmsrv.enums.WarningLevel;
import java.time.Instant;

public record AlertRuleDto(
    Long id,
    long channelId,
    DataType dataType,
    long pointId,
    String ruleName,
    WarningLevel warningLevel,
    ComparisonOperator operator,
    double value,
    boolean enabled,
    String description,
    Instant createdAt,
    Instant updatedAt
) {}
