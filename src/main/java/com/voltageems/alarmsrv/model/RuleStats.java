package com.voltageems.alarmsrv.model;

public record RuleStats(long total, long enabled) {}
