package com.voltageems.alarmsrv.repository;

import com.voltageems.alarmsrv.enums.WarningLevel;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class WarningLevelConverter implements AttributeConverter<WarningLevel, Integer> {

  @Override
  public Integer convertToDatabaseColumn(WarningLevel attribute) {
    return attribute == null ? null : attribute.level();
  }

  @Override
  public WarningLevel convertToEntityAttribute(Integer dbData) {
    if (dbData == null) {
      return null;
    }
    return WarningLevel.fromLevel(dbData)
        .orElseThrow(() -> new IllegalStateException("Unknown warning_level in store: " + dbData));
  }
}
