package com.example.registry.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Partial update of an employee. A null or blank field means "leave unchanged".
 */
public record EmployeeChanges(
    String externalKey, String name, String rights, String status, String remarks) {

  /** Supplied fields in declaration order, trimmed. */
  public Map<EmployeeField, String> presentFields() {
    final Map<EmployeeField, String> fields = new EnumMap<>(EmployeeField.class);
    for (EmployeeField field : EmployeeField.values()) {
      final String value = field.valueIn(this);
      if (value != null && !value.isBlank()) {
        fields.put(field, value.trim());
      }
    }
    return Collections.unmodifiableMap(fields);
  }

  public Optional<String> newExternalKey() {
    return Optional.ofNullable(presentFields().get(EmployeeField.EXTERNAL_KEY));
  }
}
