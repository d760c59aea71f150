package com.example.registry.service;

public class InvalidEmployeeRequestException extends RuntimeException {

  public InvalidEmployeeRequestException(String message) {
    super(message);
  }
}
