package com.mk.fx.qa.evidence.analytics;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TrendDirection {
  UP,
  DOWN,
  STABLE;

  @JsonValue
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
