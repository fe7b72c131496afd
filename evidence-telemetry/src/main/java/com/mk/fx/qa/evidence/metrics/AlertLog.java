package com.mk.fx.qa.evidence.metrics;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import lombok.extern.slf4j.Slf4j;

/** Append-only alert log of one execution. */
@Slf4j
final class AlertLog {

  private final List<Alert> alerts = new CopyOnWriteArrayList<>();

  Alert raise(
      AlertSeverity severity,
      String metric,
      double value,
      double threshold,
      String condition,
      String message,
      String contextId) {
    var alert =
        new Alert(
            newId(),
            severity,
            metric,
            value,
            threshold,
            condition,
            message,
            Instant.now(),
            contextId);
    alerts.add(alert);
    log.warn("Alert [{}] {} on {}: {}", severity, metric, contextId, message);
    return alert;
  }

  List<Alert> all() {
    return List.copyOf(alerts);
  }

  List<Alert> forContext(String contextId) {
    return alerts.stream().filter(a -> a.contextId().equals(contextId)).toList();
  }

  int size() {
    return alerts.size();
  }

  void clear() {
    alerts.clear();
  }

  private static String newId() {
    String suffix =
        Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36)
            .toLowerCase(Locale.ROOT);
    return "alert-" + System.currentTimeMillis() + "-" + suffix.substring(0, Math.min(9, suffix.length()));
  }
}
