package com.mk.fx.qa.evidence.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.evidence.model.StepStatus;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricsExporterTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private static SystemSample sample(Instant at, double cpu, double memory, double disk) {
    return new SystemSample(
        at,
        new SystemSample.CpuReading(cpu, 4, 1),
        new SystemSample.MemoryReading(100, 50, 50, memory, 10, 20, 40, 50),
        new SystemSample.DiskReading(100, 30, 70, disk, List.of()));
  }

  private static ContextSeries series() {
    var ctx = new ContextSeries("sc-\"1\"", 10);
    ctx.addSystem(sample(T0, 10, 20, 30), true);
    ctx.addSystem(sample(T0.plusSeconds(5), 12.5, 21, 30), true);
    ctx.addStep(new StepMetric(T0.plusSeconds(6), "sc-1", "st-1", "open page", 250, StepStatus.FAILED, 10));
    return ctx;
  }

  @Test
  void prometheus_emitsHelpAndTypeOncePerFamily_withLatestSample() {
    String text = new MetricsExporter().prometheus(List.of(series()));

    assertEquals(1, text.split("# HELP cpu_usage ", -1).length - 1);
    assertTrue(text.contains("# TYPE memory_usage gauge\n"));
    assertTrue(text.contains("cpu_usage{context=\"sc-\\\"1\\\"\"} 12.5 " + T0.plusSeconds(5).toEpochMilli()));
    assertTrue(text.contains("# TYPE test_duration gauge\n"));
    assertFalse(text.contains("histogram"));
    assertTrue(
        text.contains(
            "test_duration{scenario=\"sc-1\",step=\"st-1\",status=\"failed\"} 250 "
                + T0.plusSeconds(6).toEpochMilli()));
  }

  @Test
  void grafana_emitsThreePointsPerSample_plusStepDurations() {
    var points = new MetricsExporter().grafana(List.of(series()));

    assertEquals(7, points.size());
    var first = points.get(0);
    assertEquals("sc-\"1\".cpu.usage", first.name());
    assertEquals(10, first.value());
    assertEquals(T0.toEpochMilli(), first.timestamp());
    assertEquals("cpu.usage", first.tags().get("metric"));
    var step = points.get(points.size() - 1);
    assertEquals("sc-1.step.duration", step.name());
    assertEquals("st-1", step.tags().get("stepId"));
  }

  @Test
  void escape_quotesBackslashesAndNewlines() {
    assertEquals("a\\\\b\\\"c\\nd", MetricsExporter.escape("a\\b\"c\nd"));
    assertEquals("", MetricsExporter.escape(null));
  }
}
