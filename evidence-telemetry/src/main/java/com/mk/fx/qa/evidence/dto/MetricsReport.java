package com.mk.fx.qa.evidence.dto;

import com.mk.fx.qa.evidence.analytics.MetricTrend;
import com.mk.fx.qa.evidence.analytics.SeriesStats;
import com.mk.fx.qa.evidence.metrics.Alert;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final metrics report of one execution, written as {@code metrics-report.json}.
 */
public class MetricsReport {

  public String executionId;
  public Instant startTime;
  public Instant endTime;
  public long durationMs;

  public Summary summary;
  public Map<String, SystemStats> system;
  public Map<String, BrowserStats> browser;
  public Map<String, TestStats> test;
  public Map<String, CustomStats> custom;
  public Performance performance;
  public GcSummary gc;
  public List<MetricTrend> trends;
  public List<Alert> alerts;
  public List<String> recommendations;

  public static class Summary {
    public int totalScenarios;
    public long totalDataPoints;
    public double avgCpu;
    public double avgMemory;
    public double peakCpu;
    public double peakMemory;
    public int totalAlerts;
    public double errorRate;
  }

  public static class SystemStats {
    public long samples;
    public SeriesStats cpu;
    public SeriesStats memory;
    public SeriesStats disk;
  }

  public static class BrowserStats {
    public long samples;
    public SeriesStats pageLoadTime;
    public SeriesStats domContentLoaded;
    public Map<String, ResourceTypeStats> resources;
  }

  public static class ResourceTypeStats {
    public int count;
    public long totalSize;
    public double avgDuration;
  }

  public static class TestStats {
    public long totalSteps;
    public long passed;
    public long failed;
    public long skipped;
    public SeriesStats duration;
    public double errorRate;
  }

  public static class CustomStats {
    public String unit;
    public String type;
    public double latest;
    public SeriesStats values;
  }

  public static class Performance {
    public ResponseTime responseTime;
    public Throughput throughput;
    public int concurrency;
  }

  public static class ResponseTime {
    public double min;
    public double max;
    public double avg;
    public double p50;
    public double p90;
    public double p95;
    public double p99;
  }

  /** Completed steps per one-minute window. */
  public static class Throughput {
    public double avg;
    public long max;
    public int windows;
  }

  public static class GcSummary {
    public long totalCollections;
    public long totalTimeMs;
    public Map<String, Long> collectionsByCollector;
  }
}
