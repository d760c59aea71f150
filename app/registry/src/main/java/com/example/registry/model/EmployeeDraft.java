package com.example.registry.model;

/** Validated input for a new employee; {@code rights}, {@code status} and {@code remarks} may be null. */
public record EmployeeDraft(
    String externalKey, String name, String rights, String status, String remarks) {

  public EmployeeDraft {
    externalKey = externalKey == null ? null : externalKey.trim();
    name = name == null ? null : name.trim();
    rights = blankToNull(rights);
    status = blankToNull(status);
    remarks = blankToNull(remarks);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
