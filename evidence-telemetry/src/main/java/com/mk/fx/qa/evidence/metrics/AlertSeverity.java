package com.mk.fx.qa.evidence.metrics;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AlertSeverity {
  INFO,
  WARNING,
  ERROR,
  CRITICAL;

  @JsonValue
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
