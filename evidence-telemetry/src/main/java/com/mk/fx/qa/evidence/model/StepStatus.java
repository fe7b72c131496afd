package com.mk.fx.qa.evidence.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum StepStatus {
  PASSED,
  FAILED,
  SKIPPED;

  @JsonValue
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }
}
