package com.mk.fx.qa.evidence.performance;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/** Resource timing entry; times are milliseconds relative to the navigation start. */
@Builder
public record ResourceTiming(
    String name,
    String initiatorType,
    double startTime,
    double duration,
    double domainLookupStart,
    double domainLookupEnd,
    double connectStart,
    double connectEnd,
    double secureConnectionStart,
    double requestStart,
    double responseStart,
    double responseEnd,
    long transferSize,
    long encodedBodySize,
    long decodedBodySize) {

  /** Served from cache: nothing went over the wire but a body was decoded. */
  @JsonProperty("cached")
  public boolean cached() {
    return transferSize == 0 && decodedBodySize > 0;
  }
}
