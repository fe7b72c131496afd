package com.mk.fx.qa.evidence.metrics;

import java.util.Locale;

public enum ExportFormat {
  JSON,
  GRAFANA,
  PROMETHEUS;

  /** Unknown or blank values fall back to {@link #JSON}. */
  public static ExportFormat fromKey(String key) {
    if (key == null || key.isBlank()) return JSON;
    try {
      return valueOf(key.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return JSON;
    }
  }
}
