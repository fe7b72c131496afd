package com.mk.fx.qa.evidence.performance;

import com.mk.fx.qa.evidence.analytics.SampleRing;
import java.util.List;
import java.util.Optional;

/** Captured performance series of one scenario. */
final class ScenarioPerformance {

  final String scenarioId;
  final SampleRing<NavigationTiming> navigations;
  final SampleRing<ResourceTiming> resources;
  final SampleRing<CoreWebVitals> vitals;
  final SampleRing<LongTask> longTasks;
  final SampleRing<BrowserMemory> memory;

  private volatile NavigationTiming firstNavigation;
  private volatile UserTimings userTimings;
  private volatile VisualTimeline visualTimeline;
  private volatile List<ScreenFrame> frames = List.of();
  private volatile List<String> budgetViolations = List.of();
  private volatile String url;

  ScenarioPerformance(String scenarioId, int capacity) {
    this.scenarioId = scenarioId;
    this.navigations = new SampleRing<>(capacity);
    this.resources = new SampleRing<>(capacity * 20);
    this.vitals = new SampleRing<>(capacity);
    this.longTasks = new SampleRing<>(capacity * 10);
    this.memory = new SampleRing<>(capacity);
  }

  void record(PerformancePayload payload, CoreWebVitals captured, List<String> violations) {
    if (payload.navigation() != null) {
      navigations.add(payload.navigation());
      if (firstNavigation == null) firstNavigation = payload.navigation();
    }
    payload.resources().forEach(resources::add);
    payload.longTasks().forEach(longTasks::add);
    if (payload.memory() != null) memory.add(payload.memory());
    if (payload.userTimings() != null) userTimings = payload.userTimings();
    if (payload.visualTimeline() != null) visualTimeline = payload.visualTimeline();
    if (!payload.frames().isEmpty()) frames = payload.frames();
    if (payload.pageUrl() != null) url = payload.pageUrl();
    vitals.add(captured);
    budgetViolations = List.copyOf(violations);
  }

  boolean hasCaptures() {
    return vitals.written() > 0;
  }

  Optional<NavigationTiming> firstNavigation() {
    return Optional.ofNullable(firstNavigation);
  }

  Optional<NavigationTiming> latestNavigation() {
    return navigations.latest();
  }

  Optional<CoreWebVitals> latestVitals() {
    return vitals.latest();
  }

  UserTimings userTimings() {
    return userTimings;
  }

  VisualTimeline visualTimeline() {
    return visualTimeline;
  }

  List<ScreenFrame> frames() {
    return frames;
  }

  List<String> budgetViolations() {
    return budgetViolations;
  }

  String url() {
    return url;
  }

  PerformanceSummary summarise(PerformanceScorer scorer) {
    List<ResourceTiming> all = resources.snapshot();
    return scorer.summarise(
        latestVitals().orElse(null),
        latestNavigation().orElse(null),
        all,
        longTasks.size(),
        memory.snapshot(),
        url);
  }
}
