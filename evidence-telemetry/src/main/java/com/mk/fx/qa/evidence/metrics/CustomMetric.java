package com.mk.fx.qa.evidence.metrics;

import java.time.Instant;
import java.util.Map;

/**
 * A metric recorded by test code.
 *
 * @param type gauge, counter or histogram; free text
 * @param alert optional rule raising an alert when {@code value > threshold}
 */
public record CustomMetric(
    String name,
    double value,
    String unit,
    String type,
    Instant timestamp,
    Map<String, String> tags,
    AlertRule alert) {

  public CustomMetric {
    timestamp = timestamp == null ? Instant.now() : timestamp;
    tags = tags == null ? Map.of() : Map.copyOf(tags);
  }

  public static CustomMetric gauge(String name, double value, String unit) {
    return new CustomMetric(name, value, unit, "gauge", Instant.now(), Map.of(), null);
  }

  public CustomMetric withAlert(AlertRule rule) {
    return new CustomMetric(name, value, unit, type, timestamp, tags, rule);
  }

  /**
   * @param severity defaults to {@link AlertSeverity#ERROR} when null
   * @param message defaults to {@code <name> exceeded threshold} when null
   */
  public record AlertRule(double threshold, AlertSeverity severity, String message) {}
}
