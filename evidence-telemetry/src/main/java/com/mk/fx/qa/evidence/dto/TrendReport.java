package com.mk.fx.qa.evidence.dto;

import com.mk.fx.qa.evidence.analytics.Anomaly;
import com.mk.fx.qa.evidence.analytics.MetricTrend;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Trend analysis of one execution, written as {@code metrics-trends.json}. */
public class TrendReport {

  public String executionId;
  public Instant generatedAt;
  public Map<String, MetricTrend> trends;
  public Predictions predictions;
  public List<Anomaly> anomalies;
  public Map<String, Double> correlations;

  /** Least-squares projection of the next value of each series. */
  public static class Predictions {
    public double cpu;
    public double memory;
    public double errorRate;
  }
}
