package com.voltageems.alarmsrv.model;

import com.voltageems.alarmsrv.enums.ComparisonOperator;
import com.voltageems.alarmsrv.enums.DataType;
import com.voltageems.alarmsrv.enums.WarningLevel;

public record AlertRuleFields(
    long channelId,
    DataType dataType,
    long pointId,
    String ruleName,
    WarningLevel warningLevel,
    ComparisonOperator operator,
    double value,
    boolean enabled,
    String description
) {

  public RuleTuple tuple() {
    return new RuleTuple(channelId, dataType, pointId, ruleName);
  }
}
