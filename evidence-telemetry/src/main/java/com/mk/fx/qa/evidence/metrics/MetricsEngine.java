package com.mk.fx.qa.evidence.metrics;

import static com.mk.fx.qa.evidence.utils.EvidenceUtils.formatNumber;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.evidence.analytics.SampleRing;
import com.mk.fx.qa.evidence.cfg.MetricsCfg;
import com.mk.fx.qa.evidence.collector.CollectorOptions;
import com.mk.fx.qa.evidence.collector.StepCollector;
import com.mk.fx.qa.evidence.dto.MetricsReport;
import com.mk.fx.qa.evidence.model.EvidencePayload;
import com.mk.fx.qa.evidence.model.EvidenceType;
import com.mk.fx.qa.evidence.model.StepStatus;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Samples system metrics for one execution, tracks step timings and custom metrics, raises
 * threshold and leak alerts and writes the final metrics report, export and trend files.
 *
 * <p>Sampling runs on a single daemon thread named {@code metrics-sampler-<executionId>}. Each
 * sub-reading (cpu, memory, disk) is gathered independently; a failing one is logged and zeroed
 * while the others are still recorded.
 */
@Slf4j
public class MetricsEngine implements StepCollector {

  static final String HEAP_METRIC = "memory.heapUsed";
  static final String STEP_DURATION_METRIC = "step.duration";
  static final String ERROR_RATE_METRIC = "test.errorRate";
  static final int SNAPSHOT_GC_EVENTS = 10;

  private final MetricsCfg cfg;
  private final SystemSampleSource source;
  private final ObjectMapper mapper;
  private final ExportFormat exportFormat;

  private final Map<String, ContextSeries> contexts = new ConcurrentHashMap<>();
  private final Map<String, Instant> scenarioStarts = new ConcurrentHashMap<>();
  private final Map<String, Instant> stepStarts = new ConcurrentHashMap<>();
  private final AtomicInteger peakConcurrency = new AtomicInteger();
  private final AlertLog alerts = new AlertLog();
  private final LeakDetector leaks = new LeakDetector();
  private final SampleRing<GcEvent> gcEvents;
  private final List<EvidencePayload> evidence = new CopyOnWriteArrayList<>();
  private final MetricsReportBuilder reportBuilder = new MetricsReportBuilder();
  private final MetricsExporter exporter = new MetricsExporter();

  private volatile String executionId;
  private volatile Path metricsDir;
  private volatile Instant startedAt;
  private volatile MetricsReport lastReport;
  private volatile ScheduledExecutorService sampler;

  public MetricsEngine(MetricsCfg cfg, SystemSampleSource source, ObjectMapper mapper) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
    this.source = Objects.requireNonNull(source, "source");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.exportFormat = ExportFormat.fromKey(cfg.getExportFormat());
    this.gcEvents = new SampleRing<>(cfg.getSeriesCapacity());
  }

  @Override
  public EvidenceType type() {
    return EvidenceType.METRICS;
  }

  @Override
  public void initialize(String executionId, CollectorOptions options) {
    this.executionId = Objects.requireNonNull(executionId, "executionId");
    this.startedAt = Instant.now();
    this.metricsDir = options.executionDirectory(EvidenceType.METRICS.directory(), executionId);
    try {
      Files.createDirectories(metricsDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create metrics directory " + metricsDir, e);
    }
    context(executionId);
    logStart();
    if (cfg.isCollectSystemMetrics()) {
      startSampler();
    }
  }

  @Override
  public List<EvidencePayload> collectForScenario(String scenarioId, String scenarioName) {
    scenarioStarts.put(scenarioId, Instant.now());
    context(scenarioId);
    if (cfg.isCollectSystemMetrics()) {
      sampleContext(scenarioId);
    }
    log.debug("Metrics scenario {} ({}) started", scenarioId, scenarioName);
    return captureSnapshot(scenarioId, "scenario-start").map(List::of).orElse(List.of());
  }

  /**
   * The first call for a {@code (scenarioId, stepId)} pair marks the step start; the second records
   * its duration and status. A failed completion also captures a snapshot.
   */
  @Override
  public List<EvidencePayload> collectForStep(
      String scenarioId, String stepId, String stepText, StepStatus status) {
    String key = scenarioId + "::" + stepId;
    Instant started = stepStarts.remove(key);
    if (started == null) {
      stepStarts.put(key, Instant.now());
      peakConcurrency.accumulateAndGet(stepStarts.size(), Math::max);
      return List.of();
    }

    var now = Instant.now();
    long duration = Duration.between(started, now).toMillis();
    long heap = context(scenarioId).system.latest().map(s -> s.memory().heapUsed()).orElse(0L);
    var metric = new StepMetric(now, scenarioId, stepId, stepText, duration, status, heap);
    context(scenarioId).addStep(metric);

    long limit = cfg.getThresholds().getResponseTimeMs();
    if (cfg.isAlerting() && duration > limit) {
      alerts.raise(
          AlertSeverity.WARNING,
          STEP_DURATION_METRIC,
          duration,
          limit,
          "> " + limit + "ms",
          "Step duration (" + duration + "ms) exceeds threshold (" + limit + "ms)",
          scenarioId);
    }

    if (status == StepStatus.FAILED) {
      return captureSnapshot(scenarioId, "step-failed-" + stepId).map(List::of).orElse(List.of());
    }
    return List.of();
  }

  public void recordCustomMetric(String contextId, CustomMetric metric) {
    context(contextId).custom.add(metric);
    CustomMetric.AlertRule rule = metric.alert();
    if (cfg.isAlerting() && rule != null && metric.value() > rule.threshold()) {
      alerts.raise(
          rule.severity() == null ? AlertSeverity.ERROR : rule.severity(),
          metric.name(),
          metric.value(),
          rule.threshold(),
          "> " + formatNumber(rule.threshold()),
          rule.message() == null ? metric.name() + " exceeded threshold" : rule.message(),
          contextId);
    }
  }

  public void recordBrowserMetrics(String contextId, BrowserMetricsSample sample) {
    context(contextId).browser.add(sample);
  }

  @Override
  public void finalize(String executionId) {
    stopSampler();
    if (this.executionId == null) {
      log.warn("Metrics engine finalized for {} without being initialized", executionId);
      return;
    }

    double errorRate = MetricsReportBuilder.errorRate(contexts.values());
    double errorLimit = cfg.getThresholds().getErrorRate();
    if (cfg.isAlerting() && errorRate > errorLimit) {
      alerts.raise(
          AlertSeverity.WARNING,
          ERROR_RATE_METRIC,
          errorRate,
          errorLimit,
          "> " + formatNumber(errorLimit) + "%",
          String.format(
              Locale.ROOT,
              "Error rate (%.2f%%) exceeds threshold (%s%%)",
              errorRate,
              formatNumber(errorLimit)),
          executionId);
    }

    var report =
        reportBuilder.build(
            this.executionId,
            startedAt,
            contexts.values(),
            scenarioStarts.size(),
            alerts.all(),
            gcEvents.snapshot(),
            peakConcurrency.get());
    writeJson(metricsDir.resolve("metrics-report.json"), report);
    export();
    writeJson(
        metricsDir.resolve("metrics-trends.json"),
        reportBuilder.buildTrends(this.executionId, contexts.values()));
    lastReport = report;
    logFinalSummary(report);

    contexts.values().forEach(ContextSeries::clear);
    stepStarts.clear();
  }

  @Override
  public List<EvidencePayload> getEvidence() {
    return List.copyOf(evidence);
  }

  @Override
  public void clear() {
    stopSampler();
    evidence.clear();
    contexts.clear();
    scenarioStarts.clear();
    stepStarts.clear();
    alerts.clear();
    leaks.clear();
    gcEvents.clear();
  }

  public List<Alert> alerts() {
    return alerts.all();
  }

  public Optional<MetricsReport> lastReport() {
    return Optional.ofNullable(lastReport);
  }

  public Optional<Path> metricsDirectory() {
    return Optional.ofNullable(metricsDir);
  }

  /** Runs one sampling tick for the execution context on the calling thread. */
  @VisibleForTesting
  public SystemSample sampleNow() {
    return sampleContext(executionId);
  }

  private ContextSeries context(String contextId) {
    return contexts.computeIfAbsent(contextId, id -> new ContextSeries(id, cfg.getSeriesCapacity()));
  }

  private void startSampler() {
    sampler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("metrics-sampler-" + executionId);
              t.setDaemon(true);
              return t;
            });
    long intervalMs = Math.max(1, cfg.getInterval().toMillis());
    sampler.scheduleAtFixedRate(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
  }

  private void stopSampler() {
    if (sampler != null) {
      sampler.shutdownNow();
      try {
        sampler.awaitTermination(2, TimeUnit.SECONDS);
      } catch (InterruptedException ignored) {
        Thread.currentThread().interrupt();
      }
      sampler = null;
    }
  }

  private void tick() {
    try {
      var sample = sampleContext(executionId);
      if (cfg.isIncludeGcMetrics()) {
        source.readGcActivity().forEach(gcEvents::add);
      }
      logTick(sample);
    } catch (RuntimeException e) {
      // an exception escaping a scheduled task would cancel every later tick
      log.error("Metrics sampling tick failed for {}", executionId, e);
    }
  }

  private SystemSample sampleContext(String contextId) {
    var sample =
        new SystemSample(Instant.now(), readCpu(), readMemory(), readDisk());
    context(contextId).addSystem(sample, cfg.isAggregate());
    if (cfg.isAlerting()) {
      checkThresholds(contextId, sample);
    }
    if (cfg.isDetectMemoryLeaks() && sample.memory().heapUsed() > 0) {
      checkLeak(contextId, sample.memory().heapUsed());
    }
    return sample;
  }

  private SystemSample.CpuReading readCpu() {
    try {
      return source.readCpu();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return SystemSample.CpuReading.ZERO;
    } catch (Exception e) {
      log.warn("CPU reading failed for {}: {}", executionId, e.getMessage());
      return SystemSample.CpuReading.ZERO;
    }
  }

  private SystemSample.MemoryReading readMemory() {
    try {
      return source.readMemory();
    } catch (Exception e) {
      log.warn("Memory reading failed for {}: {}", executionId, e.getMessage());
      return SystemSample.MemoryReading.ZERO;
    }
  }

  private SystemSample.DiskReading readDisk() {
    try {
      return source.readDisk();
    } catch (Exception e) {
      log.warn("Disk reading failed for {}: {}", executionId, e.getMessage());
      return SystemSample.DiskReading.ZERO;
    }
  }

  private void checkThresholds(String contextId, SystemSample sample) {
    var t = cfg.getThresholds();
    double cpu = sample.cpu().usage();
    if (cpu > t.getCpu()) {
      alerts.raise(
          AlertSeverity.ERROR,
          "cpu.usage",
          cpu,
          t.getCpu(),
          "> " + formatNumber(t.getCpu()) + "%",
          usageMessage("CPU", cpu, t.getCpu()),
          contextId);
    }
    double memory = sample.memory().percent();
    if (memory > t.getMemory()) {
      alerts.raise(
          AlertSeverity.ERROR,
          "memory.usage",
          memory,
          t.getMemory(),
          "> " + formatNumber(t.getMemory()) + "%",
          usageMessage("Memory", memory, t.getMemory()),
          contextId);
    }
    double disk = sample.disk().usage();
    if (disk > t.getDisk()) {
      alerts.raise(
          AlertSeverity.WARNING,
          "disk.usage",
          disk,
          t.getDisk(),
          "> " + formatNumber(t.getDisk()) + "%",
          usageMessage("Disk", disk, t.getDisk()),
          contextId);
    }
  }

  private void checkLeak(String contextId, long heapUsed) {
    OptionalDouble growth = leaks.record(contextId, heapUsed);
    if (growth.isPresent()) {
      long baseline = leaks.baseline(contextId);
      alerts.raise(
          AlertSeverity.ERROR,
          HEAP_METRIC,
          heapUsed,
          baseline * 1.5,
          "growth > " + formatNumber(LeakDetector.GROWTH_PERCENT) + "%",
          String.format(
              Locale.ROOT,
              "Potential memory leak detected. Heap usage increased by %.2f%%",
              growth.getAsDouble()),
          contextId);
    }
  }

  private Optional<EvidencePayload> captureSnapshot(String contextId, String reason) {
    ContextSeries ctx = context(contextId);
    List<GcEvent> gc = gcEvents.snapshot();
    var snapshot =
        new MetricSnapshot(
            Instant.now(),
            reason,
            contextId,
            ctx.system.latest().orElse(null),
            ctx.browser.latest().orElse(null),
            ctx.steps.latest().orElse(null),
            ctx.custom.snapshot(),
            ctx.aggregated(),
            alerts.forContext(contextId),
            gc.subList(Math.max(0, gc.size() - SNAPSHOT_GC_EVENTS), gc.size()));
    String fileName = "snapshot-" + reason + "-" + snapshot.timestamp().toEpochMilli() + ".json";
    try {
      byte[] content = mapper.writeValueAsBytes(snapshot);
      Files.write(metricsDir.resolve(fileName), content);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("reason", reason);
      metadata.put("contextId", contextId);
      metadata.put("file", fileName);
      var payload =
          new EvidencePayload(
              EvidenceType.METRICS,
              "snapshot-" + reason,
              "Metrics snapshot (" + reason + ")",
              content,
              null,
              null,
              metadata,
              List.of("metrics", "snapshot"));
      evidence.add(payload);
      return Optional.of(payload);
    } catch (IOException e) {
      log.error("Failed to write metrics snapshot {} for {}", fileName, contextId, e);
      return Optional.empty();
    }
  }

  private void export() {
    try {
      switch (exportFormat) {
        case GRAFANA -> writeJsonOrThrow(
            metricsDir.resolve("metrics-grafana-" + executionId + ".json"),
            exporter.grafana(contexts.values()));
        case PROMETHEUS -> Files.writeString(
            metricsDir.resolve("metrics-prometheus-" + executionId + ".txt"),
            exporter.prometheus(contexts.values()));
        case JSON -> {
          // metrics-report.json is the JSON export
        }
      }
    } catch (IOException | RuntimeException e) {
      log.error("Failed to export metrics for {} as {}", executionId, exportFormat, e);
    }
  }

  private void writeJson(Path file, Object value) {
    try {
      writeJsonOrThrow(file, value);
    } catch (IOException e) {
      log.error("Failed to write {}", file, e);
    }
  }

  private void writeJsonOrThrow(Path file, Object value) throws IOException {
    try {
      Files.write(file, mapper.writeValueAsBytes(value));
    } catch (JsonProcessingException e) {
      throw new IOException("Cannot serialise " + file.getFileName(), e);
    }
  }

  private void logStart() {
    var sb = new StringBuilder();
    sb.append("Metrics for ")
        .append(executionId)
        .append(" started: interval=")
        .append(cfg.getInterval().toMillis())
        .append("ms, system=")
        .append(cfg.isCollectSystemMetrics())
        .append(", gc=")
        .append(cfg.isIncludeGcMetrics())
        .append(", alerting=")
        .append(cfg.isAlerting())
        .append(", leakDetection=")
        .append(cfg.isDetectMemoryLeaks())
        .append(", export=")
        .append(exportFormat)
        .append(", dir=")
        .append(metricsDir);
    log.info(sb.toString());
  }

  private void logTick(SystemSample sample) {
    if (!log.isDebugEnabled()) return;
    var sb = new StringBuilder();
    sb.append("Metrics ")
        .append(executionId)
        .append(" tick: cpu=")
        .append(String.format(Locale.ROOT, "%.2f", sample.cpu().usage()))
        .append("%, mem=")
        .append(String.format(Locale.ROOT, "%.2f", sample.memory().percent()))
        .append("%, heap=")
        .append(sample.memory().heapUsed() / (1024 * 1024))
        .append("MB, disk=")
        .append(String.format(Locale.ROOT, "%.2f", sample.disk().usage()))
        .append("%, alerts=")
        .append(alerts.size());
    log.debug(sb.toString());
  }

  private void logFinalSummary(MetricsReport report) {
    var s = report.summary;
    var sb = new StringBuilder();
    sb.append("Metrics for ")
        .append(executionId)
        .append(" completed: scenarios=")
        .append(s.totalScenarios)
        .append(", dataPoints=")
        .append(s.totalDataPoints)
        .append(", cpu avg/peak=")
        .append(String.format(Locale.ROOT, "%.2f/%.2f", s.avgCpu, s.peakCpu))
        .append(", mem avg/peak=")
        .append(String.format(Locale.ROOT, "%.2f/%.2f", s.avgMemory, s.peakMemory))
        .append(", errorRate=")
        .append(String.format(Locale.ROOT, "%.2f%%", s.errorRate))
        .append(", alerts=")
        .append(s.totalAlerts);
    log.info(sb.toString());
  }

  private static String usageMessage(String label, double value, double threshold) {
    return String.format(
        Locale.ROOT,
        "%s usage (%.2f%%) exceeds threshold (%s%%)",
        label,
        value,
        formatNumber(threshold));
  }
}
