package com.example.registry.common;

import java.util.UUID;

public final class RequestIds {

  private static final int MAX_LENGTH = 128;

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** Returns the caller supplied id when usable, otherwise a freshly generated one. */
  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newRequestId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.length() > MAX_LENGTH) {
      return trimmed.substring(0, MAX_LENGTH);
    }
    return trimmed;
  }
}
