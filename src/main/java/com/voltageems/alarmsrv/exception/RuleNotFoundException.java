package com.voltageems.alarmsrv.exception;

public class RuleNotFoundException extends RuleException {

  private final long ruleId;

  public RuleNotFoundException(long ruleId) {
    super("Alarm rule " + ruleId + " does not exist");
    this.ruleId = ruleId;
  }

  public long getRuleId() {
    return ruleId;
  }
}
