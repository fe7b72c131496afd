package com.mk.fx.qa.evidence.performance;

import java.util.List;
import java.util.Map;

/**
 * Scored view of the latest capture of a scenario.
 *
 * @param score weighted score over the available vitals, 0..1
 * @param scores per-vital scores, only for vitals that were available
 * @param violations {@code Poor <vital>} entries for vitals scoring below 0.5
 * @param pageLoad navigation total of the latest capture
 * @param domReady navigation domComplete of the latest capture
 */
public record PerformanceSummary(
    double score,
    Map<String, Double> scores,
    String grade,
    List<String> violations,
    double pageLoad,
    double domReady,
    Resources resources,
    List<String> recommendations) {

  public record Resources(
      int total, int cached, long totalSize, double totalDuration, Map<String, ResourceGroup> byType) {}
}
