package com.voltageems.alarmsrv.exception;

public class StoreInitializationException extends RuntimeException {

  public StoreInitializationException(String message) {
    super(message);
  }

  public StoreInitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
