package com.mk.fx.qa.evidence.metrics;

import com.mk.fx.qa.evidence.analytics.Anomaly;
import com.mk.fx.qa.evidence.analytics.MetricTrend;
import com.mk.fx.qa.evidence.analytics.Statistics;
import com.mk.fx.qa.evidence.analytics.TrendMath;
import com.mk.fx.qa.evidence.dto.MetricsReport;
import com.mk.fx.qa.evidence.dto.TrendReport;
import com.mk.fx.qa.evidence.model.StepStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

final class MetricsReportBuilder {

  static final double CPU_SPIKE_DELTA = 30.0;

  static final String HIGH_CPU =
      "High CPU usage detected. Consider optimizing compute-intensive operations or scaling resources.";
  static final String HIGH_MEMORY =
      "High memory usage detected. Review for memory leaks and optimize memory allocation.";
  static final String MEMORY_LEAK =
      "Potential memory leak detected. Profile application memory usage and fix leaks.";
  static final String HIGH_RESPONSE_TIME =
      "High average response time. Optimize slow operations and consider caching.";

  MetricsReport build(
      String executionId,
      Instant startedAt,
      Collection<ContextSeries> contexts,
      int scenarioCount,
      List<Alert> alerts,
      List<GcEvent> gcEvents,
      int peakConcurrency) {

    var r = new MetricsReport();

    // identifiers & timing
    r.executionId = executionId;
    r.startTime = startedAt;
    var end = Instant.now();
    r.endTime = end;
    r.durationMs = Math.max(0, Duration.between(startedAt, end).toMillis());

    // per context sections
    Map<String, MetricsReport.SystemStats> system = new LinkedHashMap<>();
    Map<String, MetricsReport.BrowserStats> browser = new LinkedHashMap<>();
    Map<String, MetricsReport.TestStats> test = new LinkedHashMap<>();
    Map<String, List<CustomMetric>> customByName = new LinkedHashMap<>();
    List<StepMetric> allSteps = new ArrayList<>();
    for (ContextSeries ctx : contexts) {
      if (ctx.system.size() > 0) {
        system.put(ctx.contextId, systemStats(ctx));
      }
      if (ctx.browser.size() > 0) {
        browser.put(ctx.contextId, browserStats(ctx.browser.snapshot()));
      }
      if (ctx.totalSteps() > 0) {
        test.put(ctx.contextId, testStats(ctx));
      }
      for (CustomMetric m : ctx.custom.snapshot()) {
        customByName.computeIfAbsent(m.name(), k -> new ArrayList<>()).add(m);
      }
      allSteps.addAll(ctx.steps.snapshot());
    }
    r.system = system;
    r.browser = browser;
    r.test = test;
    r.custom = customStats(customByName);

    // summary
    var s = new MetricsReport.Summary();
    s.totalScenarios = scenarioCount;
    s.totalDataPoints = contexts.stream().mapToLong(ContextSeries::dataPoints).sum();
    long cpuCount = 0;
    double cpuSum = 0;
    double memSum = 0;
    for (ContextSeries ctx : contexts) {
      cpuCount += ctx.cpu.count();
      cpuSum += ctx.cpu.sum();
      memSum += ctx.memory.sum();
      s.peakCpu = Math.max(s.peakCpu, ctx.cpu.max());
      s.peakMemory = Math.max(s.peakMemory, ctx.memory.max());
    }
    s.avgCpu = cpuCount == 0 ? 0 : cpuSum / cpuCount;
    s.avgMemory = cpuCount == 0 ? 0 : memSum / cpuCount;
    s.totalAlerts = alerts.size();
    s.errorRate = errorRate(contexts);
    r.summary = s;

    r.performance = performance(allSteps, peakConcurrency);
    r.gc = gcSummary(gcEvents);

    double[] cpu = combinedSeries(contexts, true);
    double[] memory = combinedSeries(contexts, false);
    var trends = new ArrayList<MetricTrend>();
    TrendMath.trend("cpu", cpu).ifPresent(trends::add);
    TrendMath.trend("memory", memory).ifPresent(trends::add);
    r.trends = trends;
    r.alerts = alerts;
    r.recommendations = recommendations(s, alerts, r.performance.responseTime.avg);
    return r;
  }

  TrendReport buildTrends(String executionId, Collection<ContextSeries> contexts) {
    var t = new TrendReport();
    t.executionId = executionId;
    t.generatedAt = Instant.now();

    double[] cpu = combinedSeries(contexts, true);
    double[] memory = combinedSeries(contexts, false);
    Map<String, MetricTrend> trends = new LinkedHashMap<>();
    TrendMath.trend("cpu", cpu).ifPresent(tr -> trends.put("cpu", tr));
    TrendMath.trend("memory", memory).ifPresent(tr -> trends.put("memory", tr));
    t.trends = trends;

    var p = new TrendReport.Predictions();
    p.cpu = TrendMath.forecast(cpu);
    p.memory = TrendMath.forecast(memory);
    p.errorRate = TrendMath.forecast(runningErrorRates(contexts));
    t.predictions = p;

    List<Anomaly> anomalies = new ArrayList<>();
    for (ContextSeries ctx : contexts) {
      List<SystemSample> samples = ctx.system.snapshot();
      double[] values = samples.stream().mapToDouble(x -> x.cpu().usage()).toArray();
      for (int i : TrendMath.spikeIndexes(values, CPU_SPIKE_DELTA)) {
        anomalies.add(
            new Anomaly(
                "cpu_spike",
                ctx.contextId,
                samples.get(i).timestamp(),
                values[i],
                values[i - 1],
                values[i] - values[i - 1]));
      }
    }
    t.anomalies = anomalies;
    t.correlations = Map.of("cpuMemory", TrendMath.pearson(cpu, memory));
    return t;
  }

  private MetricsReport.SystemStats systemStats(ContextSeries ctx) {
    List<SystemSample> samples = ctx.system.snapshot();
    var out = new MetricsReport.SystemStats();
    out.samples = ctx.system.written();
    out.cpu = Statistics.summarise(samples.stream().mapToDouble(x -> x.cpu().usage()).toArray());
    out.memory =
        Statistics.summarise(samples.stream().mapToDouble(x -> x.memory().percent()).toArray());
    out.disk = Statistics.summarise(samples.stream().mapToDouble(x -> x.disk().usage()).toArray());
    return out;
  }

  private MetricsReport.BrowserStats browserStats(List<BrowserMetricsSample> samples) {
    var out = new MetricsReport.BrowserStats();
    out.samples = samples.size();
    out.pageLoadTime =
        Statistics.summarise(samples.stream().mapToDouble(BrowserMetricsSample::pageLoadTime).toArray());
    out.domContentLoaded =
        Statistics.summarise(
            samples.stream().mapToDouble(BrowserMetricsSample::domContentLoaded).toArray());
    Map<String, MetricsReport.ResourceTypeStats> byType = new TreeMap<>();
    Map<String, Double> durationSums = new TreeMap<>();
    for (BrowserMetricsSample sample : samples) {
      for (BrowserMetricsSample.ResourceSample res : sample.resources()) {
        String type = res.type() == null ? "other" : res.type();
        var stats = byType.computeIfAbsent(type, k -> new MetricsReport.ResourceTypeStats());
        stats.count++;
        stats.totalSize += res.size();
        durationSums.merge(type, res.duration(), Double::sum);
      }
    }
    byType.forEach((type, stats) -> stats.avgDuration = durationSums.get(type) / stats.count);
    out.resources = byType;
    return out;
  }

  private MetricsReport.TestStats testStats(ContextSeries ctx) {
    var out = new MetricsReport.TestStats();
    out.totalSteps = ctx.totalSteps();
    out.passed = ctx.stepCount(StepStatus.PASSED);
    out.failed = ctx.stepCount(StepStatus.FAILED);
    out.skipped = ctx.stepCount(StepStatus.SKIPPED);
    out.duration =
        Statistics.summarise(ctx.steps.snapshot().stream().mapToDouble(StepMetric::durationMs).toArray());
    out.errorRate = out.totalSteps == 0 ? 0 : (double) out.failed / out.totalSteps * 100.0;
    return out;
  }

  private Map<String, MetricsReport.CustomStats> customStats(Map<String, List<CustomMetric>> byName) {
    Map<String, MetricsReport.CustomStats> out = new LinkedHashMap<>();
    byName.forEach(
        (name, metrics) -> {
          var stats = new MetricsReport.CustomStats();
          CustomMetric last = metrics.get(metrics.size() - 1);
          stats.unit = last.unit();
          stats.type = last.type();
          stats.latest = last.value();
          stats.values =
              Statistics.summarise(metrics.stream().mapToDouble(CustomMetric::value).toArray());
          out.put(name, stats);
        });
    return out;
  }

  private MetricsReport.Performance performance(List<StepMetric> steps, int peakConcurrency) {
    var perf = new MetricsReport.Performance();

    double[] sorted = steps.stream().mapToDouble(StepMetric::durationMs).sorted().toArray();
    var rt = new MetricsReport.ResponseTime();
    if (sorted.length > 0) {
      rt.min = sorted[0];
      rt.max = sorted[sorted.length - 1];
      rt.avg = Statistics.average(sorted);
      rt.p50 = Statistics.nearestRank(sorted, 50);
      rt.p90 = Statistics.nearestRank(sorted, 90);
      rt.p95 = Statistics.nearestRank(sorted, 95);
      rt.p99 = Statistics.nearestRank(sorted, 99);
    }
    perf.responseTime = rt;

    Map<Long, Long> perMinute = new TreeMap<>();
    for (StepMetric step : steps) {
      perMinute.merge(step.timestamp().toEpochMilli() / 60_000L, 1L, Long::sum);
    }
    var tp = new MetricsReport.Throughput();
    tp.windows = perMinute.size();
    tp.max = perMinute.values().stream().mapToLong(Long::longValue).max().orElse(0);
    tp.avg = tp.windows == 0 ? 0 : (double) steps.size() / tp.windows;
    perf.throughput = tp;
    perf.concurrency = peakConcurrency;
    return perf;
  }

  private MetricsReport.GcSummary gcSummary(List<GcEvent> events) {
    var gc = new MetricsReport.GcSummary();
    Map<String, Long> byCollector = new TreeMap<>();
    for (GcEvent e : events) {
      gc.totalCollections += e.collections();
      gc.totalTimeMs += e.durationMs();
      byCollector.merge(e.collector(), e.collections(), Long::sum);
    }
    gc.collectionsByCollector = byCollector;
    return gc;
  }

  private List<String> recommendations(
      MetricsReport.Summary summary, List<Alert> alerts, double avgResponseTime) {
    List<String> out = new ArrayList<>();
    if (summary.avgCpu > 70) out.add(HIGH_CPU);
    if (summary.avgMemory > 80) out.add(HIGH_MEMORY);
    if (alerts.stream().anyMatch(a -> MetricsEngine.HEAP_METRIC.equals(a.metric()))) {
      out.add(MEMORY_LEAK);
    }
    if (summary.errorRate > 10) {
      out.add(
          String.format(
              Locale.ROOT,
              "High error rate (%.2f%%). Investigate failing tests and improve stability.",
              summary.errorRate));
    }
    if (avgResponseTime > 3000) out.add(HIGH_RESPONSE_TIME);
    return out;
  }

  static double errorRate(Collection<ContextSeries> contexts) {
    long total = 0;
    long failed = 0;
    for (ContextSeries ctx : contexts) {
      total += ctx.totalSteps();
      failed += ctx.stepCount(StepStatus.FAILED);
    }
    return total == 0 ? 0 : (double) failed / total * 100.0;
  }

  /** System samples of every context merged in time order. */
  private static double[] combinedSeries(Collection<ContextSeries> contexts, boolean cpu) {
    return contexts.stream()
        .flatMap(ctx -> ctx.system.snapshot().stream())
        .sorted(Comparator.comparing(SystemSample::timestamp))
        .mapToDouble(x -> cpu ? x.cpu().usage() : x.memory().percent())
        .toArray();
  }

  /** Cumulative failure percentage after each completed step, in completion order. */
  private static double[] runningErrorRates(Collection<ContextSeries> contexts) {
    StepMetric[] steps =
        contexts.stream()
            .flatMap(ctx -> ctx.steps.snapshot().stream())
            .sorted(Comparator.comparing(StepMetric::timestamp))
            .toArray(StepMetric[]::new);
    double[] rates = new double[steps.length];
    int failed = 0;
    for (int i = 0; i < steps.length; i++) {
      if (steps[i].status() == StepStatus.FAILED) failed++;
      rates[i] = (double) failed / (i + 1) * 100.0;
    }
    return rates;
  }
}
