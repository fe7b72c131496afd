package com.mk.fx.qa.evidence.analytics;

/**
 * Distribution summary of a numeric series.
 *
 * <p>For a non-empty series {@code min <= avg <= max} and
 * {@code min <= p50 <= p90 <= p95 <= p99 <= max}. An empty series yields all zeros.
 */
public record SeriesStats(
    double min,
    double max,
    double avg,
    double sum,
    int count,
    double p50,
    double p75,
    double p90,
    double p95,
    double p99) {

  public static final SeriesStats EMPTY = new SeriesStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

  public double median() {
    return p50;
  }
}
