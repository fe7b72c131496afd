package com.mk.fx.qa.evidence.performance;

import static com.mk.fx.qa.evidence.utils.EvidenceUtils.formatNumber;

import com.mk.fx.qa.evidence.cfg.PerformanceCfg;
import com.mk.fx.qa.evidence.utils.EvidenceUtils;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Scores vitals, grades scenarios and checks captures against the performance budget.
 */
public class PerformanceScorer {

  static final Map<String, Double> WEIGHTS =
      Map.of("FCP", 0.10, "LCP", 0.25, "FID", 0.30, "CLS", 0.25, "TTFB", 0.10);

  private static final Map<String, String> VITAL_NAMES =
      Map.of(
          "FCP", "First Contentful Paint",
          "LCP", "Largest Contentful Paint",
          "FID", "First Input Delay",
          "CLS", "Cumulative Layout Shift",
          "TTFB", "Time to First Byte");

  static final long LARGE_RESOURCE_BYTES = 500_000;
  static final int LONG_TASK_LIMIT = 5;

  private final PerformanceCfg.Budget budget;

  public PerformanceScorer(PerformanceCfg.Budget budget) {
    this.budget = Objects.requireNonNull(budget, "budget");
  }

  /** Four tiers: {@code <= 0.75t} 1, {@code <= t} 0.75, {@code <= 1.5t} 0.5, else 0.25. */
  public static double metricScore(double value, double threshold) {
    if (value <= threshold * 0.75) return 1;
    if (value <= threshold) return 0.75;
    if (value <= threshold * 1.5) return 0.5;
    return 0.25;
  }

  public static double clsScore(double cls) {
    if (cls <= 0.1) return 1;
    if (cls <= 0.25) return 0.75;
    return 0.5;
  }

  public static String grade(double score) {
    if (score >= 0.9) return "A";
    if (score >= 0.8) return "B";
    if (score >= 0.7) return "C";
    if (score >= 0.6) return "D";
    return "F";
  }

  /** Scores of the vitals that are available, keyed FCP, LCP, FID, CLS, TTFB. */
  public Map<String, Double> scores(CoreWebVitals vitals) {
    Map<String, Double> scores = new LinkedHashMap<>();
    if (vitals == null) return scores;
    vitals.fcp().asOptional().ifPresent(v -> scores.put("FCP", metricScore(v, budget.getFcp())));
    vitals.lcp().asOptional().ifPresent(v -> scores.put("LCP", metricScore(v, budget.getLcp())));
    vitals.fid().asOptional().ifPresent(v -> scores.put("FID", metricScore(v, budget.getFid())));
    vitals.cls().asOptional().ifPresent(v -> scores.put("CLS", clsScore(v)));
    vitals.ttfb().asOptional().ifPresent(v -> scores.put("TTFB", metricScore(v, budget.getTtfb())));
    return scores;
  }

  /** Weighted average with the weights of the present vitals renormalised; 0 when none. */
  public static double overallScore(Map<String, Double> scores) {
    double weighted = 0;
    double weights = 0;
    for (var e : scores.entrySet()) {
      double w = WEIGHTS.getOrDefault(e.getKey(), 0.0);
      weighted += w * e.getValue();
      weights += w;
    }
    return weights == 0 ? 0 : weighted / weights;
  }

  public static List<String> summaryViolations(Map<String, Double> scores) {
    List<String> out = new ArrayList<>();
    for (String key : List.of("FCP", "LCP", "FID", "CLS", "TTFB")) {
      Double score = scores.get(key);
      if (score != null && score < 0.5) {
        out.add("Poor " + VITAL_NAMES.get(key));
      }
    }
    return out;
  }

  /** Advisory budget violations of one capture. */
  public List<String> budgetViolations(
      CoreWebVitals vitals, NavigationTiming navigation, List<ResourceTiming> resources) {
    List<String> out = new ArrayList<>();
    if (vitals != null) {
      msOver(out, "FCP", vitals.fcp(), budget.getFcp());
      msOver(out, "LCP", vitals.lcp(), budget.getLcp());
      msOver(out, "FID", vitals.fid(), budget.getFid());
      vitals
          .cls()
          .asOptional()
          .ifPresent(
              cls -> {
                if (cls > budget.getCls()) {
                  out.add(
                      "CLS (" + formatNumber(cls) + ") exceeds threshold ("
                          + formatNumber(budget.getCls()) + ")");
                }
              });
      msOver(out, "TTFB", vitals.ttfb(), budget.getTtfb());
      msOver(out, "TTI", vitals.tti(), budget.getTti());
      msOver(out, "TBT", vitals.tbt(), budget.getTbt());
      msOver(out, "INP", vitals.inp(), budget.getInp());
    }
    if (navigation != null && navigation.total() > budget.getPageLoad()) {
      out.add(
          "Page load time (" + formatNumber(navigation.total()) + "ms) exceeds threshold ("
              + formatNumber(budget.getPageLoad()) + "ms)");
    }
    long slow = resources.stream().filter(r -> r.duration() > budget.getResourceLoad()).count();
    if (slow > 0) {
      out.add(
          slow + " resources exceed load time threshold (" + formatNumber(budget.getResourceLoad())
              + "ms)");
    }
    return out;
  }

  /**
   * Improvement hints for a scenario.
   *
   * @param vitals latest capture, may be null
   * @param memory browser heap snapshots oldest first
   * @param pageUrl page URL used to tell first-party from third-party resources
   */
  public List<String> recommendations(
      CoreWebVitals vitals,
      List<ResourceTiming> resources,
      int longTaskCount,
      List<BrowserMemory> memory,
      String pageUrl) {
    List<String> out = new ArrayList<>();
    if (vitals != null) {
      if (vitals.fcp().orElse(0) > budget.getFcp()) {
        out.add(
            "Reduce server response time and eliminate render-blocking resources to improve FCP");
      }
      if (vitals.lcp().orElse(0) > budget.getLcp()) {
        out.add("Optimize largest content element loading (images, videos, or large text blocks)");
      }
      if (vitals.cls().orElse(0) > budget.getCls()) {
        out.add("Add size attributes to images and videos to prevent layout shifts");
        out.add("Avoid inserting content above existing content");
      }
      if (vitals.ttfb().orElse(0) > budget.getTtfb()) {
        out.add("Improve server response time - consider caching, CDN, or server optimization");
      }
    }

    long uncached = resources.stream().filter(r -> !r.cached()).count();
    if (uncached > resources.size() * 0.5) {
      out.add("Enable caching for static resources to improve load times");
    }
    long large = resources.stream().filter(r -> r.transferSize() > LARGE_RESOURCE_BYTES).count();
    if (large > 0) {
      out.add("Optimize " + large + " large resources (>500KB)");
    }
    if (longTaskCount > LONG_TASK_LIMIT) {
      out.add("Break up long JavaScript tasks to improve interactivity");
    }
    if (memory.size() > 1) {
      long first = memory.get(0).usedJsHeapSize();
      long last = memory.get(memory.size() - 1).usedJsHeapSize();
      if (first > 0) {
        double growth = (double) (last - first) / first * 100.0;
        if (growth > 50) {
          out.add(
              String.format(
                  Locale.ROOT,
                  "Memory usage increased by %.1f%% - check for memory leaks",
                  growth));
        }
      }
    }
    String pageHost = EvidenceUtils.hostOf(pageUrl);
    if (pageHost != null) {
      long thirdParty = resources.stream().filter(r -> isThirdParty(r.name(), pageHost)).count();
      if (thirdParty > resources.size() * 0.3) {
        out.add("Reduce dependency on third-party resources");
      }
    }
    return out;
  }

  /** Summary of a scenario's latest capture. */
  public PerformanceSummary summarise(
      CoreWebVitals vitals,
      NavigationTiming navigation,
      List<ResourceTiming> resources,
      int longTaskCount,
      List<BrowserMemory> memory,
      String pageUrl) {
    Map<String, Double> scores = scores(vitals);
    double score = overallScore(scores);
    Map<String, ResourceGroup> byType = new LinkedHashMap<>();
    for (ResourceTiming r : resources) {
      byType.merge(
          r.initiatorType() == null ? "other" : r.initiatorType(),
          ResourceGroup.EMPTY.plus(r),
          (a, b) -> a.plus(r));
    }
    var resourceSummary =
        new PerformanceSummary.Resources(
            resources.size(),
            (int) resources.stream().filter(ResourceTiming::cached).count(),
            resources.stream().mapToLong(ResourceTiming::transferSize).sum(),
            resources.stream().mapToDouble(ResourceTiming::duration).sum(),
            byType);
    return new PerformanceSummary(
        score,
        scores,
        grade(score),
        summaryViolations(scores),
        navigation == null ? 0 : navigation.total(),
        navigation == null ? 0 : navigation.domComplete(),
        resourceSummary,
        recommendations(vitals, resources, longTaskCount, memory, pageUrl));
  }

  /** Resource whose host differs from the page host; relative or unparsable names are first party. */
  static boolean isThirdParty(String resourceUrl, String pageHost) {
    String host = EvidenceUtils.hostOf(resourceUrl);
    return host != null && !host.equalsIgnoreCase(pageHost);
  }

  private static void msOver(List<String> out, String label, VitalReading reading, double limit) {
    reading
        .asOptional()
        .ifPresent(
            v -> {
              if (v > limit) {
                out.add(
                    label + " (" + formatNumber(v) + "ms) exceeds threshold (" + formatNumber(limit)
                        + "ms)");
              }
            });
  }
}
