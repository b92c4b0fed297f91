package com.voltageems.alarmsrv.service;

import com.voltageems.alarmsrv.enums.ComparisonOperator;
import com.voltageems.alarmsrv.enums.DataType;
import com.voltageems.alarmsrv.enums.WarningLevel;
import com.voltageems.alarmsrv.exception.RuleValidationException;
import com.voltageems.alarmsrv.model.AlertRuleFields;
import com.voltageems.alarmsrv.model.AlertRuleRequest;
import org.springframework.stereotype.Component;

@Component
public class RuleValidator {

  static final int MAX_PAGE_SIZE = 500;

  public AlertRuleFields validate(AlertRuleRequest request) {
    if (request == null) {
      throw new RuleValidationException("rule", "request body is required");
    }
    long channelId = requirePositive("channelId", request.channelId());
    DataType dataType = requireDataType(request.dataType());
    long pointId = requirePositive("pointId", request.pointId());
    String ruleName = requireRuleName(request.ruleName());
    WarningLevel warningLevel = requireWarningLevel(request.warningLevel());
    ComparisonOperator operator = ComparisonOperator.fromSymbol(request.operator())
        .orElseThrow(() -> new RuleValidationException(
            "operator", "must be one of >, <, >=, <=, ==, != but was " + describe(request.operator())));
    double value = requireFinite(request.value());

    return new AlertRuleFields(
        channelId,
        dataType,
        pointId,
        ruleName,
        warningLevel,
        operator,
        value,
        request.enabled() == null || request.enabled(),
        request.description() == null ? "" : request.description()
    );
  }

  public DataType requireDataType(String code) {
    return DataType.fromCode(code)
        .orElseThrow(() -> new RuleValidationException(
            "dataType", "must be one of T, S, C, A but was " + describe(code)));
  }

  public WarningLevel requireWarningLevel(Integer level) {
    return WarningLevel.fromLevel(level)
        .orElseThrow(() -> new RuleValidationException(
            "warningLevel", "must be one of 1, 2, 3 but was " + describe(level)));
  }

  public long requirePositive(String field, Long id) {
    if (id == null) {
      throw new RuleValidationException(field, "is required");
    }
    if (id <= 0) {
      throw new RuleValidationException(field, "must be positive but was " + id);
    }
    return id;
  }

  public void requirePage(int page, int pageSize) {
    if (page < 1) {
      throw new RuleValidationException("page", "must be at least 1 but was " + page);
    }
    if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      throw new RuleValidationException(
          "pageSize", "must be between 1 and " + MAX_PAGE_SIZE + " but was " + pageSize);
    }
  }

  private String requireRuleName(String ruleName) {
    if (ruleName == null || ruleName.isBlank()) {
      throw new RuleValidationException("ruleName", "must not be empty");
    }
    return ruleName.trim();
  }

  private double requireFinite(Double value) {
    if (value == null) {
      throw new RuleValidationException("value", "is required");
    }
    if (value.isNaN() || value.isInfinite()) {
      throw new RuleValidationException("value", "must be a finite number but was " + value);
    }
    return value;
  }

  private static String describe(Object raw) {
    return raw == null ? "missing" : "'" + raw + "'";
  }
}
