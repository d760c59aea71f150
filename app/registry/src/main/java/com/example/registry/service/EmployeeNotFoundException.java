package com.example.registry.service;

public class EmployeeNotFoundException extends RuntimeException {
  public EmployeeNotFoundException(long id) {
    super("employee " + id + " not found");
  }
}
