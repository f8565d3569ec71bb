package com.audience.segments.repository;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/** Stores an ordered list of rule ids as a comma-separated string. */
@Converter
public class RuleIdListConverter implements AttributeConverter<List<Long>, String> {

  @Override
  public String convertToDatabaseColumn(List<Long> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (Long id : attribute) {
      if (sb.length() > 0) {
        sb.append(',');
      }
      sb.append(id);
    }
    return sb.toString();
  }

  @Override
  public List<Long> convertToEntityAttribute(String dbData) {
    List<Long> ids = new ArrayList<>();
    if (dbData == null || dbData.isBlank()) {
      return ids;
    }
    for (String part : dbData.split(",")) {
      ids.add(Long.parseLong(part.trim()));
    }
    return ids;
  }
}
