package com.mk.fx.qa.evidence.performance;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Speed Index: the integral of visual incompleteness over time.
 *
 * <p>The primary method integrates over a {@link VisualTimeline}. When no usable timeline exists
 * the integral is taken over render-relevant resources (css, img, script) with completeness
 * measured as decoded bytes loaded.
 */
public final class SpeedIndexCalculator {

  private static final Set<String> CRITICAL_TYPES = Set.of("css", "img", "script");

  private SpeedIndexCalculator() {
    // Utility class, no instantiation
  }

  public static double speedIndex(VisualTimeline timeline, List<ResourceTiming> resources) {
    return fromTimeline(timeline).orElseGet(() -> fromResources(resources));
  }

  /** Empty when the timeline is missing, has no events or no viewport area. */
  public static OptionalDouble fromTimeline(VisualTimeline timeline) {
    if (timeline == null
        || timeline.events().isEmpty()
        || !(timeline.viewportArea() > 0)) {
      return OptionalDouble.empty();
    }
    double viewport = timeline.viewportArea();
    List<VisualTimeline.VisualEvent> events =
        timeline.events().stream()
            .sorted(Comparator.comparingDouble(VisualTimeline.VisualEvent::time))
            .toList();
    double cumulative = 0;
    double lastTime = 0;
    double sum = 0;
    for (VisualTimeline.VisualEvent event : events) {
      sum += (event.time() - lastTime) * (1 - cumulative / viewport);
      cumulative = Math.min(cumulative + Math.max(0, event.area()), viewport);
      lastTime = event.time();
    }
    if (lastTime < timeline.loadTime()) {
      sum += (timeline.loadTime() - lastTime) * (1 - cumulative / viewport);
    }
    return OptionalDouble.of(sum);
  }

  /** 0 when there are no render-relevant resources or none carries a decoded size. */
  public static double fromResources(List<ResourceTiming> resources) {
    List<ResourceTiming> critical =
        resources.stream()
            .filter(r -> CRITICAL_TYPES.contains(r.initiatorType()))
            .sorted(Comparator.comparingDouble(ResourceTiming::responseEnd))
            .toList();
    long totalBytes = critical.stream().mapToLong(ResourceTiming::decodedBodySize).sum();
    if (totalBytes <= 0) return 0;
    double sum = 0;
    double lastTime = 0;
    long loaded = 0;
    for (ResourceTiming r : critical) {
      sum += (r.responseEnd() - lastTime) * (1 - (double) loaded / totalBytes);
      loaded += r.decodedBodySize();
      lastTime = r.responseEnd();
    }
    return sum;
  }
}
