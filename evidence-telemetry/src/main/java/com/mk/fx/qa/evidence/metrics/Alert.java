package com.mk.fx.qa.evidence.metrics;

import java.time.Instant;

/**
 * A threshold breach raised while sampling.
 *
 * @param metric dotted metric name, e.g. {@code cpu.usage}
 * @param condition human readable breach condition, e.g. {@code > 80%}
 * @param contextId execution or scenario the alert belongs to
 */
public record Alert(
    String id,
    AlertSeverity severity,
    String metric,
    double value,
    double threshold,
    String condition,
    String message,
    Instant timestamp,
    String contextId) {}
