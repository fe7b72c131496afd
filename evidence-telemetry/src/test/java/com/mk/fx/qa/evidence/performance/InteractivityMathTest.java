package com.mk.fx.qa.evidence.performance;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class InteractivityMathTest {

  private static NavigationTiming nav(double responseEnd, double domContentLoadedEnd) {
    return NavigationTiming.builder()
        .responseEnd(responseEnd)
        .domContentLoadedEventEnd(domContentLoadedEnd)
        .build();
  }

  @Test
  void timeToInteractive_noLongTasks_addsQuietWindowToDomContentLoaded() {
    assertEquals(6200, InteractivityMath.timeToInteractive(nav(800, 1200), List.of()), 1e-9);
  }

  @Test
  void timeToInteractive_tasksAfterStart_extendToLastTaskEnd() {
    var tasks =
        List.of(
            new LongTask(3000, 80, null),
            new LongTask(1500, 100, "window"),
            // starts before the value reached by the previous task, ignored
            new LongTask(1550, 300, null));

    double tti = InteractivityMath.timeToInteractive(nav(800, 1200), tasks);

    assertEquals(3080 + 5000, tti, 1e-9);
  }

  @Test
  void timeToInteractive_tasksBeforeStart_ignored() {
    var tasks = List.of(new LongTask(500, 200, null));
    assertEquals(6000, InteractivityMath.timeToInteractive(nav(1000, 900), tasks), 1e-9);
  }

  @Test
  void totalBlockingTime_countsOnlyTasksStrictlyBetweenFcpAndTti() {
    var tasks =
        List.of(
            new LongTask(100, 200, null), // before fcp
            new LongTask(1000, 120, null), // 70
            new LongTask(2000, 50, null), // 0
            new LongTask(3000, 250, null), // 200
            new LongTask(9000, 400, null)); // after tti

    assertEquals(270, InteractivityMath.totalBlockingTime(tasks, 500, 8000), 1e-9);
  }

  @Test
  void totalBlockingTime_taskStartingAtFcp_excluded() {
    var tasks = List.of(new LongTask(500, 150, null));
    assertEquals(0, InteractivityMath.totalBlockingTime(tasks, 500, 8000), 1e-9);
  }

  @Test
  void interactionToNextPaint_picks75thPercentileIndex() {
    assertEquals(
        400, InteractivityMath.interactionToNextPaint(List.of(300.0, 100.0, 400.0, 200.0)), 1e-9);
    assertEquals(
        80, InteractivityMath.interactionToNextPaint(List.of(80.0)), 1e-9);
  }

  @Test
  void interactionToNextPaint_empty_returnsZero() {
    assertEquals(0, InteractivityMath.interactionToNextPaint(List.of()), 1e-9);
  }

  @Test
  void interactionToNextPaint_negativeAndNonFinite_ignored() {
    assertEquals(
        200,
        InteractivityMath.interactionToNextPaint(
            List.of(-10.0, Double.NaN, 100.0, 200.0, Double.POSITIVE_INFINITY)),
        1e-9);
  }
}
