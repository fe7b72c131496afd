package com.mk.fx.qa.evidence.dto;

import com.mk.fx.qa.evidence.analytics.SeriesStats;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Cross-scenario analysis written as {@code performance-analysis.json}. */
public class PerformanceAnalysis {

  public String executionId;
  public Instant timestamp;
  public Network network;
  public Rendering rendering;
  public Interactivity interactivity;
  public ResourceOptimization resourceOptimization;
  public ThirdPartyImpact thirdPartyImpact;

  public static class Network {
    public Phase dns;
    public Phase tcp;
    public double sslOverhead;
    public Ttfb ttfb;
  }

  public static class Phase {
    public double average;
    public List<String> recommendations;
  }

  public static class Ttfb {
    public double average;
    /** Redirect cost estimated at 100 ms per redirect. */
    public double redirect;
    public double serverProcessing;
  }

  public static class Rendering {
    public SeriesStats fcp;
    public SeriesStats lcp;
    public SeriesStats cls;
  }

  public static class Interactivity {
    public SeriesStats fid;
    public SeriesStats inp;
    public SeriesStats tbt;
    public int longTaskCount;
    public double longTaskTotalDuration;
  }

  public static class ResourceOptimization {
    public List<Opportunity> opportunities;
  }

  /**
   * @param potentialSavings bytes for compression, milliseconds for caching
   */
  public record Opportunity(String type, String impact, int resources, double potentialSavings) {}

  public static class ThirdPartyImpact {
    public int count;
    public long totalSize;
    public double totalDuration;
    public double percentage;
    public Map<String, DomainUsage> byDomain;
  }

  public record DomainUsage(int count, long size, double duration) {}
}
