package com.voltageems.alarmsrv.exception;

import com.voltageems.alarmsrv.model.RuleTuple;

public class DuplicateRuleException extends RuleException {

  private final RuleTuple tuple;

  public DuplicateRuleException(RuleTuple tuple, Throwable cause) {
    super("A rule named '" + tuple.ruleName() + "' already exists for channel "
        + tuple.channelId() + ", data type " + tuple.dataType().code()
        + ", point " + tuple.pointId(), cause);
    this.tuple = tuple;
  }

  public RuleTuple getTuple() {
    return tuple;
  }
}
