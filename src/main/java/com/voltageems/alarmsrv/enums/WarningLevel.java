package com.voltageems.alarmsrv.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

public enum WarningLevel {
  LOW(1),
  MEDIUM(2),
  HIGH(3);

  private final int level;

  WarningLevel(int level) {
    this.level = level;
  }

  @JsonValue
  public int level() {
    return level;
  }

  public static Optional<WarningLevel> fromLevel(Integer level) {
    if (level == null) {
      return Optional.empty();
    }
    for (WarningLevel candidate : values()) {
      if (candidate.level == level) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
