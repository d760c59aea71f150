package com.example.registry.repository;

/** The database could not be reached within the configured number of start-up attempts. */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
