package com.mk.fx.qa.evidence.performance;

import java.util.Comparator;
import java.util.List;

/** Time to interactive, total blocking time and INP derivations. */
public final class InteractivityMath {

  /** Quiet window appended after the last long task. */
  static final double QUIET_WINDOW_MS = 5000;

  /** Portion of a long task above this counts as blocking. */
  static final double BLOCKING_THRESHOLD_MS = 50;

  private InteractivityMath() {
    // Utility class, no instantiation
  }

  /**
   * Starts at {@code max(responseEnd, domContentLoadedEventEnd)}, responseEnd standing in for FCP.
   * Every long task, in start order, that begins after the current value moves it to the task's
   * end. The quiet window is added last.
   */
  public static double timeToInteractive(NavigationTiming navigation, List<LongTask> longTasks) {
    double tti = Math.max(navigation.responseEnd(), navigation.domContentLoadedEventEnd());
    List<LongTask> sorted =
        longTasks.stream().sorted(Comparator.comparingDouble(LongTask::startTime)).toList();
    for (LongTask task : sorted) {
      if (task.startTime() > tti) {
        tti = task.startTime() + Math.max(0, task.duration());
      }
    }
    return tti + QUIET_WINDOW_MS;
  }

  /** Sum of {@code duration - 50} over long tasks starting strictly between FCP and TTI. */
  public static double totalBlockingTime(List<LongTask> longTasks, double fcp, double tti) {
    double tbt = 0;
    for (LongTask task : longTasks) {
      if (task.startTime() > fcp && task.startTime() < tti) {
        tbt += Math.max(0, task.duration() - BLOCKING_THRESHOLD_MS);
      }
    }
    return tbt;
  }

  /**
   * 75th percentile of interaction durations with the {@code sorted[floor(n * 0.75)]} rule.
   * Negative and non-finite durations are ignored; 0 when none remain.
   */
  public static double interactionToNextPaint(List<Double> durations) {
    double[] sorted =
        durations.stream()
            .mapToDouble(Double::doubleValue)
            .filter(d -> Double.isFinite(d) && d >= 0)
            .sorted()
            .toArray();
    if (sorted.length == 0) return 0;
    int idx = (int) Math.floor(sorted.length * 0.75);
    return sorted[Math.min(sorted.length - 1, idx)];
  }
}
