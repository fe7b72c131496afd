package com.mk.fx.qa.evidence.analytics;

import java.time.Instant;

/** A consecutive-sample jump larger than the configured spike threshold. */
public record Anomaly(
    String type,
    String contextId,
    Instant timestamp,
    double value,
    double previousValue,
    double change) {}
