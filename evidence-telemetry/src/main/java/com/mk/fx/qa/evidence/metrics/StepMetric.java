package com.mk.fx.qa.evidence.metrics;

import com.mk.fx.qa.evidence.model.StepStatus;
import java.time.Instant;

/**
 * Timing of one completed step.
 *
 * @param durationMs time between the step's start and completion marks
 * @param heapUsed JVM heap in use when the step completed
 */
public record StepMetric(
    Instant timestamp,
    String scenarioId,
    String stepId,
    String stepText,
    long durationMs,
    StepStatus status,
    long heapUsed) {}
