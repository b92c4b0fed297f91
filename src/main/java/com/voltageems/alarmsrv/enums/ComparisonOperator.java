package com.voltageems.alarmsrv.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

public enum ComparisonOperator {
  GREATER_THAN(">"),
  LESS_THAN("<"),
  GREATER_THAN_OR_EQUAL(">="),
  LESS_THAN_OR_EQUAL("<="),
  EQUALS("=="),
  NOT_EQUALS("!=");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  @JsonValue
  public String symbol() {
    return symbol;
  }

  public static Optional<ComparisonOperator> fromSymbol(String symbol) {
    if (symbol == null) {
      return Optional.empty();
    }
    for (ComparisonOperator operator : values()) {
      if (operator.symbol.equals(symbol)) {
        return Optional.of(operator);
      }
    }
    return Optional.empty();
  }
}
