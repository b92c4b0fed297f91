package com.voltageems.alarmsrv.exception;

/**
 * Base type for failures of a single rule operation. None of them is fatal to
 * the process.
 */
public abstract class RuleException extends RuntimeException {

  protected RuleException(String message) {
    super(message);
  }

  protected RuleException(String message, Throwable cause) {
    super(message, cause);
  }
}
