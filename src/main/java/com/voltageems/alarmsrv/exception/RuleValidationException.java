package com.voltageems.alarmsrv.exception;

public class RuleValidationException extends RuleException {

  private final String field;

  public RuleValidationException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
