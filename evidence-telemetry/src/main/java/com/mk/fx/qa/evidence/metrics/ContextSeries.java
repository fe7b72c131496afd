package com.mk.fx.qa.evidence.metrics;

import com.mk.fx.qa.evidence.analytics.RunningAggregate;
import com.mk.fx.qa.evidence.analytics.SampleRing;
import com.mk.fx.qa.evidence.model.StepStatus;
import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/** All series and running aggregates kept for one context (execution or scenario). */
final class ContextSeries {

  final String contextId;
  final Instant startTime = Instant.now();
  final SampleRing<SystemSample> system;
  final SampleRing<BrowserMetricsSample> browser;
  final SampleRing<StepMetric> steps;
  final SampleRing<CustomMetric> custom;

  final RunningAggregate cpu = new RunningAggregate();
  final RunningAggregate memory = new RunningAggregate();
  final RunningAggregate disk = new RunningAggregate();
  final RunningAggregate stepDuration = new RunningAggregate();

  private final LongAdder passed = new LongAdder();
  private final LongAdder failed = new LongAdder();
  private final LongAdder skipped = new LongAdder();
  private volatile Instant lastSampleAt;

  ContextSeries(String contextId, int capacity) {
    this.contextId = contextId;
    this.system = new SampleRing<>(capacity);
    this.browser = new SampleRing<>(capacity);
    this.steps = new SampleRing<>(capacity);
    this.custom = new SampleRing<>(capacity);
  }

  void addSystem(SystemSample sample, boolean aggregate) {
    system.add(sample);
    lastSampleAt = sample.timestamp();
    if (aggregate) {
      cpu.record(sample.cpu().usage());
      memory.record(sample.memory().percent());
      disk.record(sample.disk().usage());
    }
  }

  void addStep(StepMetric metric) {
    steps.add(metric);
    stepDuration.record(metric.durationMs());
    switch (metric.status()) {
      case PASSED -> passed.increment();
      case FAILED -> failed.increment();
      case SKIPPED -> skipped.increment();
    }
  }

  long stepCount(StepStatus status) {
    return switch (status) {
      case PASSED -> passed.sum();
      case FAILED -> failed.sum();
      case SKIPPED -> skipped.sum();
    };
  }

  long totalSteps() {
    return passed.sum() + failed.sum() + skipped.sum();
  }

  long dataPoints() {
    return system.written() + browser.written() + steps.written() + custom.written();
  }

  AggregatedMetrics aggregated() {
    return new AggregatedMetrics(
        startTime,
        lastSampleAt,
        system.written(),
        cpu.snapshot(),
        memory.snapshot(),
        disk.snapshot());
  }

  void clear() {
    system.clear();
    browser.clear();
    steps.clear();
    custom.clear();
  }
}
