package com.example.registry.service;

public enum ExportFormat {
  CSV("csv", "text/csv"),
  JSON("json", "application/json");

  private final String extension;
  private final String contentType;

  ExportFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String extension() {
    return extension;
  }

  public String contentType() {
    return contentType;
  }
}
