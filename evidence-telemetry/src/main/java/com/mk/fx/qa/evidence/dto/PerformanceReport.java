package com.mk.fx.qa.evidence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mk.fx.qa.evidence.analytics.Anomaly;
import com.mk.fx.qa.evidence.analytics.MetricTrend;
import com.mk.fx.qa.evidence.analytics.SeriesStats;
import com.mk.fx.qa.evidence.performance.LongTask;
import com.mk.fx.qa.evidence.performance.PerformanceSummary;
import com.mk.fx.qa.evidence.performance.ResourceGroup;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final browser performance report of one execution, written as {@code performance-report.json}.
 */
public class PerformanceReport {

  public String executionId;
  public Instant timestamp;
  public List<ScenarioReport> scenarios;
  public Summary summary;
  public Benchmarks benchmarks;

  public static class ScenarioReport {
    public String scenarioId;
    public int executions;
    /** Stats per navigation phase: dns, tcp, ssl, ttfb, transfer, domProcessing, onLoad, total. */
    public Map<String, SeriesStats> navigation;
    public ResourceAnalysis resources;
    /** Stats per vital over the available readings. */
    public Map<String, SeriesStats> webVitals;
    public LongTaskAnalysis longTasks;
    public MemoryAnalysis memory;
    public PerformanceSummary summary;
    public Map<String, MetricTrend> trends;
    public List<Anomaly> anomalies;
    public Map<String, Double> correlations;
  }

  public static class ResourceAnalysis {
    public int total;
    public Map<String, ResourceGroup> byType;
    public List<ResourceEntry> slowest;
    public List<ResourceEntry> largest;
    public double cacheHitRate;
    public long totalTransferSize;
    public double totalDuration;
  }

  public record ResourceEntry(String name, double duration, long size, String type) {}

  public static class LongTaskAnalysis {
    public int count;
    public double totalDuration;
    public SeriesStats duration;
    public List<LongTask> worstTasks;
  }

  public static class MemoryAnalysis {
    public HeapState initial;
    @JsonProperty("final")
    public HeapState last;
    public long growthAbsolute;
    public double growthPercentage;
    public long peak;
    public double average;
  }

  public record HeapState(long used, long total, long limit) {}

  public static class Summary {
    public int totalScenarios;
    public double overallScore;
    public String grade;
    public int passedBudget;
    public int failedBudget;
    public List<String> topViolations;
    public List<String> recommendations;
  }

  public static class Benchmarks {
    public Map<String, Band> webVitals;
    public Map<String, Percentiles> industry;
  }

  public record Band(double good, double poor) {}

  public record Percentiles(double p50, double p75, double p90) {}
}
