package com.mk.fx.qa.evidence.metrics;

import java.time.Instant;

/**
 * Garbage collector activity observed between two ticks.
 *
 * @param collections number of collections in the interval
 * @param durationMs accumulated collection time in the interval
 */
public record GcEvent(Instant timestamp, String collector, long collections, long durationMs) {}
