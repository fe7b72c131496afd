package com.mk.fx.qa.evidence.performance;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;

/**
 * Navigation timing entry of one page load. Times are milliseconds relative to the navigation
 * start; derived phases are exposed as read-only properties.
 */
@Builder
public record NavigationTiming(
    Instant timestamp,
    String url,
    double fetchStart,
    double domainLookupStart,
    double domainLookupEnd,
    double connectStart,
    double connectEnd,
    double secureConnectionStart,
    double requestStart,
    double responseStart,
    double responseEnd,
    double domInteractive,
    double domContentLoadedEventStart,
    double domContentLoadedEventEnd,
    double domComplete,
    double loadEventStart,
    double loadEventEnd,
    int redirectCount,
    String type,
    String protocol,
    long transferSize,
    long encodedBodySize,
    long decodedBodySize) {

  @JsonProperty("dns")
  public double dns() {
    return domainLookupEnd - domainLookupStart;
  }

  @JsonProperty("tcp")
  public double tcp() {
    return connectEnd - connectStart;
  }

  @JsonProperty("ssl")
  public double ssl() {
    return secureConnectionStart > 0 ? connectEnd - secureConnectionStart : 0;
  }

  @JsonProperty("ttfb")
  public double ttfb() {
    return responseStart - fetchStart;
  }

  @JsonProperty("transfer")
  public double transfer() {
    return responseEnd - responseStart;
  }

  @JsonProperty("domProcessing")
  public double domProcessing() {
    return domComplete - domInteractive;
  }

  @JsonProperty("onLoad")
  public double onLoad() {
    return loadEventEnd - loadEventStart;
  }

  @JsonProperty("total")
  public double total() {
    return loadEventEnd - fetchStart;
  }
}
