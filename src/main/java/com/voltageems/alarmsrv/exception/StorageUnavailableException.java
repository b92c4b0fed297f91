package com.voltageems.alarmsrv.exception;

public class StorageUnavailableException extends RuleException {

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
