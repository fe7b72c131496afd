package com.mk.fx.qa.evidence.performance;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.evidence.cfg.PerformanceCfg;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PerformanceScorerTest {

  private final PerformanceScorer scorer = new PerformanceScorer(new PerformanceCfg.Budget());

  private static CoreWebVitals vitals(
      VitalReading fcp, VitalReading lcp, VitalReading fid, VitalReading cls, VitalReading ttfb) {
    return new CoreWebVitals(
        Instant.now(),
        "https://app.example.com/",
        fcp,
        lcp,
        fid,
        cls,
        ttfb,
        VitalReading.notSupported(),
        VitalReading.notSupported(),
        VitalReading.notSupported(),
        VitalReading.notSupported());
  }

  @Test
  void metricScore_lcpTiers() {
    assertEquals(1.0, PerformanceScorer.metricScore(1800, 2500));
    assertEquals(0.75, PerformanceScorer.metricScore(2000, 2500));
    assertEquals(0.5, PerformanceScorer.metricScore(3500, 2500));
    assertEquals(0.25, PerformanceScorer.metricScore(4000, 2500));
  }

  @Test
  void clsScore_tiers() {
    assertEquals(1.0, PerformanceScorer.clsScore(0.05));
    assertEquals(0.75, PerformanceScorer.clsScore(0.2));
    assertEquals(0.5, PerformanceScorer.clsScore(0.4));
  }

  @Test
  void grade_boundaries() {
    assertEquals("A", PerformanceScorer.grade(0.9));
    assertEquals("B", PerformanceScorer.grade(0.85));
    assertEquals("C", PerformanceScorer.grade(0.7));
    assertEquals("D", PerformanceScorer.grade(0.6));
    assertEquals("F", PerformanceScorer.grade(0.59));
  }

  @Test
  void overallScore_missingVitals_renormalisesWeights() {
    // LCP 0.25 weight at 1.0, CLS 0.25 weight at 0.5
    assertEquals(0.75, PerformanceScorer.overallScore(Map.of("LCP", 1.0, "CLS", 0.5)), 1e-9);
    assertEquals(0, PerformanceScorer.overallScore(Map.of()), 1e-9);
  }

  @Test
  void scores_onlyAvailableVitals() {
    var v =
        vitals(
            VitalReading.of(1000),
            VitalReading.timedOut(),
            VitalReading.notSupported(),
            VitalReading.of(0.3),
            VitalReading.of(1500));

    Map<String, Double> scores = scorer.scores(v);

    assertEquals(List.of("FCP", "CLS", "TTFB"), List.copyOf(scores.keySet()));
    assertEquals(1.0, scores.get("FCP"));
    assertEquals(0.5, scores.get("CLS"));
    assertEquals(0.25, scores.get("TTFB"));
    assertEquals(List.of("Poor Time to First Byte"), PerformanceScorer.summaryViolations(scores));
  }

  @Test
  void budgetViolations_reportsEveryExceededBudget() {
    var v =
        vitals(
            VitalReading.of(1000),
            VitalReading.of(3000),
            VitalReading.of(50),
            VitalReading.of(0.3),
            VitalReading.of(200));
    var nav = NavigationTiming.builder().fetchStart(0).loadEventEnd(4500).build();
    var slow = ResourceTiming.builder().name("https://cdn.example.net/a.js").duration(1500).build();
    var fast = ResourceTiming.builder().name("https://app.example.com/b.css").duration(20).build();

    List<String> violations = scorer.budgetViolations(v, nav, List.of(slow, fast));

    assertEquals(
        List.of(
            "LCP (3000ms) exceeds threshold (2500ms)",
            "CLS (0.3) exceeds threshold (0.1)",
            "Page load time (4500ms) exceeds threshold (3000ms)",
            "1 resources exceed load time threshold (1000ms)"),
        violations);
  }

  @Test
  void budgetViolations_withinBudget_isEmpty() {
    var v =
        vitals(
            VitalReading.of(900),
            VitalReading.of(1200),
            VitalReading.of(10),
            VitalReading.of(0.01),
            VitalReading.of(100));
    assertTrue(scorer.budgetViolations(v, null, List.of()).isEmpty());
  }

  @Test
  void isThirdParty_comparesHosts() {
    assertTrue(PerformanceScorer.isThirdParty("https://cdn.other.net/x.js", "app.example.com"));
    assertFalse(PerformanceScorer.isThirdParty("https://APP.example.com/x.js", "app.example.com"));
    assertFalse(PerformanceScorer.isThirdParty("/static/x.js", "app.example.com"));
  }

  @Test
  void recommendations_thirdPartyHeavyAndUncached() {
    var resources =
        List.of(
            ResourceTiming.builder().name("https://cdn.other.net/a.js").transferSize(100).build(),
            ResourceTiming.builder().name("https://ads.other.net/b.js").transferSize(100).build(),
            ResourceTiming.builder()
                .name("https://app.example.com/c.css")
                .transferSize(600_000)
                .build());

    List<String> hints =
        scorer.recommendations(null, resources, 6, List.of(), "https://app.example.com/home");

    assertTrue(hints.contains("Enable caching for static resources to improve load times"));
    assertTrue(hints.contains("Optimize 1 large resources (>500KB)"));
    assertTrue(hints.contains("Break up long JavaScript tasks to improve interactivity"));
    assertTrue(hints.contains("Reduce dependency on third-party resources"));
  }
}
