package com.mk.fx.qa.evidence.metrics;

import com.mk.fx.qa.evidence.analytics.RunningAggregate;
import java.time.Instant;

/** Running cpu, memory and disk aggregates of one context. */
public record AggregatedMetrics(
    Instant startTime,
    Instant endTime,
    long samples,
    RunningAggregate.Snapshot cpu,
    RunningAggregate.Snapshot memory,
    RunningAggregate.Snapshot disk) {}
