package com.voltageems.alarmsrv.model;

/**
 * Rule fields as supplied by a caller, before validation. Every field is
 * nullable so the service can report exactly which one is missing or out of
 * range.
 */
public record AlertRuleRequest(
    Long channelId,
    String dataType,
    Long pointId,
    String ruleName,
    Integer warningLevel,
    String operator,
    Double value,
    Boolean enabled,
    String description
) {}
