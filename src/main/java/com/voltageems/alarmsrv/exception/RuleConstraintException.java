package com.voltageems.alarmsrv.exception;

public class RuleConstraintException extends RuleException {

  public enum Kind {
    UNIQUE_TUPLE,
    CHECK,
    NOT_NULL,
    OTHER
  }

  private final Kind kind;

  public RuleConstraintException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
