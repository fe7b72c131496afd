package com.mk.fx.qa.evidence.analytics;

/**
 * Direction and projected next value of one metric series.
 *
 * @param changePercent change of the second-half mean relative to the first-half mean
 * @param forecast least-squares projection of the next sample
 */
public record MetricTrend(
    String metric, TrendDirection direction, double changePercent, double forecast) {}
