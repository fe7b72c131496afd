package com.mk.fx.qa.evidence.performance;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SpeedIndexCalculatorTest {

  private static ResourceTiming resource(String type, double responseEnd, long decoded) {
    return ResourceTiming.builder()
        .name("https://app.example.com/" + type + responseEnd)
        .initiatorType(type)
        .responseEnd(responseEnd)
        .decodedBodySize(decoded)
        .build();
  }

  @Test
  void fromTimeline_integratesIncompletenessOverTime() {
    var timeline =
        new VisualTimeline(
            1000,
            2000,
            List.of(
                new VisualTimeline.VisualEvent(500, 0),
                new VisualTimeline.VisualEvent(1000, 500),
                new VisualTimeline.VisualEvent(1500, 500)));

    // 500*1 + 500*1 + 500*0.5, fully painted after 1500
    assertEquals(1250, SpeedIndexCalculator.fromTimeline(timeline).orElseThrow(), 1e-9);
  }

  @Test
  void fromTimeline_partialPaint_extendsToLoadTime() {
    var timeline =
        new VisualTimeline(
            1000, 3000, List.of(new VisualTimeline.VisualEvent(1000, 400)));

    assertEquals(1000 + 2000 * 0.6, SpeedIndexCalculator.fromTimeline(timeline).orElseThrow(), 1e-9);
  }

  @Test
  void fromTimeline_unusable_isEmpty() {
    assertTrue(SpeedIndexCalculator.fromTimeline(null).isEmpty());
    assertTrue(SpeedIndexCalculator.fromTimeline(new VisualTimeline(1000, 100, List.of())).isEmpty());
    assertTrue(
        SpeedIndexCalculator.fromTimeline(
                new VisualTimeline(0, 100, List.of(new VisualTimeline.VisualEvent(10, 5))))
            .isEmpty());
  }

  @Test
  void fromResources_weightsByDecodedBytes() {
    var resources =
        List.of(
            resource("script", 600, 300),
            resource("css", 200, 100),
            resource("fetch", 50, 10_000));

    // css done at 200 (1/4 loaded), script done at 600
    assertEquals(200 + 400 * 0.75, SpeedIndexCalculator.fromResources(resources), 1e-9);
  }

  @Test
  void fromResources_noCriticalBytes_returnsZero() {
    assertEquals(0, SpeedIndexCalculator.fromResources(List.of(resource("fetch", 100, 50))), 1e-9);
    assertEquals(0, SpeedIndexCalculator.fromResources(List.of()), 1e-9);
  }

  @Test
  void speedIndex_fallsBackToResourcesWithoutTimeline() {
    var resources = List.of(resource("img", 400, 100));
    assertEquals(400, SpeedIndexCalculator.speedIndex(null, resources), 1e-9);
  }
}
