package com.mk.fx.qa.evidence.metrics;

import java.time.Instant;
import java.util.List;

/** Page-level timings reported by the browser for one navigation. */
public record BrowserMetricsSample(
    Instant timestamp,
    String url,
    double pageLoadTime,
    double domContentLoaded,
    double firstPaint,
    List<ResourceSample> resources) {

  public BrowserMetricsSample {
    timestamp = timestamp == null ? Instant.now() : timestamp;
    resources = resources == null ? List.of() : List.copyOf(resources);
  }

  /** @param type initiator type such as script, img or css */
  public record ResourceSample(String name, String type, double duration, long size) {}
}
