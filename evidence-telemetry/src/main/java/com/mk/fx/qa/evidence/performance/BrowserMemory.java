package com.mk.fx.qa.evidence.performance;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** JavaScript heap figures as reported by the browser. */
public record BrowserMemory(
    Instant timestamp, long usedJsHeapSize, long totalJsHeapSize, long jsHeapSizeLimit) {

  @JsonProperty("usagePercent")
  public double usagePercent() {
    return jsHeapSizeLimit > 0 ? (double) usedJsHeapSize / jsHeapSizeLimit * 100.0 : 0;
  }
}
