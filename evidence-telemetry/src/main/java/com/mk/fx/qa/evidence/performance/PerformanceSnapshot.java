package com.mk.fx.qa.evidence.performance;

import java.time.Instant;
import java.util.List;

/**
 * Immutable capture of a scenario's latest performance state, written when a step fails.
 *
 * @param reason e.g. {@code step-failed-<stepId>}
 */
public record PerformanceSnapshot(
    Instant timestamp,
    String scenarioId,
    String reason,
    NavigationTiming navigation,
    List<ResourceTiming> resources,
    CoreWebVitals webVitals,
    List<LongTask> longTasks,
    BrowserMemory memory,
    UserTimings userTimings,
    List<String> budgetViolations,
    PerformanceSummary summary) {}
