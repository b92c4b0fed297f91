package com.voltageems.alarmsrv.repository;

import com.voltageems.alarmsrv.enums.ComparisonOperator;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ComparisonOperatorConverter implements AttributeConverter<ComparisonOperator, String> {

  @Override
  public String convertToDatabaseColumn(ComparisonOperator attribute) {
    return attribute == null ? null : attribute.symbol();
  }

  @Override
  public ComparisonOperator convertToEntityAttribute(String dbData) {
    if (dbData == null) {
      return null;
    }
    return ComparisonOperator.fromSymbol(dbData)
        .orElseThrow(() -> new IllegalStateException("Unknown operator in store: " + dbData));
  }
}
