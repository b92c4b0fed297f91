package com.voltageems.alarmsrv.repository;

import com.voltageems.alarmsrv.enums.DataType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class DataTypeConverter implements AttributeConverter<DataType, String> {

  @Override
  public String convertToDatabaseColumn(DataType attribute) {
    return attribute == null ? null : attribute.code();
  }

  @Override
  public DataType convertToEntityAttribute(String dbData) {
    if (dbData == null) {
      return null;
    }
    return DataType.fromCode(dbData)
        .orElseThrow(() -> new IllegalStateException("Unknown data_type in store: " + dbData));
  }
}
