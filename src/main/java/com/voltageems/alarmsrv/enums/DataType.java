package com.voltageems.alarmsrv.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * Kind of point a rule watches. Persisted and exchanged as its one-letter code.
 */
public enum DataType {
  TELEMETRY("T"),
  STATUS("S"),
  CONTROL("C"),
  ADJUSTMENT("A");

  private final String code;

  DataType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  public static Optional<DataType> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (DataType type : values()) {
      if (type.code.equals(code)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
