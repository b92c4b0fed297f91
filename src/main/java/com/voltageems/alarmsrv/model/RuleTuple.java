package com.voltageems.alarmsrv.model;

import com.voltageems.alarmsrv.enums.DataType;

public record RuleTuple(
    long channelId,
    DataType dataType,
    long pointId,
    String ruleName
) {}
