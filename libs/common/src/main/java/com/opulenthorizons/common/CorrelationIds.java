package com.opulenthorizons.common;

import java.util.UUID;

public final class CorrelationIds {
  private CorrelationIds() {}

  public static String newCorrelationId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newCorrelationId();
    }
    return candidate.trim();
  }
}
