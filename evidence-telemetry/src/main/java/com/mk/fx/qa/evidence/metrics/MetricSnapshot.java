package com.mk.fx.qa.evidence.metrics;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of one context, captured at scenario start and on step failure.
 *
 * @param reason {@code scenario-start} or {@code step-failed-<stepId>}
 */
public record MetricSnapshot(
    Instant timestamp,
    String reason,
    String contextId,
    SystemSample system,
    BrowserMetricsSample browser,
    StepMetric test,
    List<CustomMetric> custom,
    AggregatedMetrics aggregated,
    List<Alert> alerts,
    List<GcEvent> gc) {}
