package com.mk.fx.qa.evidence.performance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.evidence.cfg.PerformanceCfg;
import com.mk.fx.qa.evidence.collector.CollectorOptions;
import com.mk.fx.qa.evidence.collector.StepCollector;
import com.mk.fx.qa.evidence.dto.PerformanceReport;
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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-execution browser performance processor.
 *
 * <p>Captures come from a {@link BrowserProbe} attached to the scenario (read on every step) or are
 * pushed with {@link #recordPayload}. Each capture is turned into {@link CoreWebVitals} with TTI,
 * TBT and Speed Index derived, and checked against the budget. Failed steps produce a
 * {@link PerformanceSnapshot}. {@link #finalize(String)} writes the report, the detailed analysis,
 * the resource waterfall and, when frames were captured, the filmstrip.
 */
@Slf4j
public class PerformanceEngine implements StepCollector {

  private final PerformanceCfg cfg;
  private final ObjectMapper mapper;
  private final PerformanceScorer scorer;
  private final PerformanceReportBuilder reportBuilder;

  private final Map<String, ScenarioPerformance> scenarios = new ConcurrentHashMap<>();
  private final Map<String, BrowserProbe> probes = new ConcurrentHashMap<>();
  private final List<EvidencePayload> evidence = new CopyOnWriteArrayList<>();

  private volatile String executionId;
  private volatile Path performanceDir;
  private volatile PerformanceReport lastReport;
  private volatile ExecutorService probeExecutor;

  public PerformanceEngine(PerformanceCfg cfg, ObjectMapper mapper) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.scorer = new PerformanceScorer(cfg.getBudget());
    this.reportBuilder = new PerformanceReportBuilder(scorer);
  }

  @Override
  public EvidenceType type() {
    return EvidenceType.PERFORMANCE;
  }

  @Override
  public void initialize(String executionId, CollectorOptions options) {
    this.executionId = Objects.requireNonNull(executionId, "executionId");
    this.performanceDir =
        options.executionDirectory(EvidenceType.PERFORMANCE.directory(), executionId);
    try {
      Files.createDirectories(performanceDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create performance directory " + performanceDir, e);
    }
    var counter = new AtomicInteger();
    probeExecutor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r);
              t.setName("performance-probe-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    log.info(
        "Performance collection for {} started: vitalsTimeout={}ms, dir={}",
        executionId,
        cfg.getVitalsTimeout().toMillis(),
        performanceDir);
  }

  public void attachProbe(String scenarioId, BrowserProbe probe) {
    probes.put(scenarioId, Objects.requireNonNull(probe, "probe"));
  }

  public void detachProbe(String scenarioId) {
    probes.remove(scenarioId);
  }

  @Override
  public List<EvidencePayload> collectForScenario(String scenarioId, String scenarioName) {
    scenarios.put(scenarioId, new ScenarioPerformance(scenarioId, cfg.getSeriesCapacity()));
    log.info("Started performance collection for scenario {} ({})", scenarioName, scenarioId);
    return List.of();
  }

  @Override
  public List<EvidencePayload> collectForStep(
      String scenarioId, String stepId, String stepText, StepStatus status) {
    BrowserProbe probe = probes.get(scenarioId);
    if (probe != null) {
      capture(scenarioId, probe).ifPresent(payload -> recordPayload(scenarioId, payload));
    }
    if (status == StepStatus.FAILED) {
      ScenarioPerformance state = scenarios.get(scenarioId);
      if (state != null && state.hasCaptures()) {
        return snapshot(state, "step-failed-" + stepId).map(List::of).orElse(List.of());
      }
    }
    return List.of();
  }

  /**
   * Processes one capture for {@code scenarioId}: derives the computed vitals, stores the capture
   * and logs budget violations.
   */
  public CoreWebVitals recordPayload(String scenarioId, PerformancePayload payload) {
    ScenarioPerformance state =
        scenarios.computeIfAbsent(
            scenarioId, id -> new ScenarioPerformance(id, cfg.getSeriesCapacity()));
    CoreWebVitals vitals = deriveVitals(payload);
    List<String> violations =
        scorer.budgetViolations(vitals, payload.navigation(), payload.resources());
    state.record(payload, vitals, violations);
    if (!violations.isEmpty()) {
      log.warn(
          "Performance budget violations for scenario {} ({}): {}",
          scenarioId,
          payload.pageUrl(),
          violations);
    }
    return vitals;
  }

  @Override
  public void finalize(String executionId) {
    shutdownProbes();
    if (this.executionId == null) {
      log.warn("Performance engine finalized for {} without being initialized", executionId);
      return;
    }
    var report = reportBuilder.build(this.executionId, scenarios.values());
    writeJson(performanceDir.resolve("performance-report.json"), report);
    writeJson(
        performanceDir.resolve("performance-analysis.json"),
        reportBuilder.analysis(this.executionId, scenarios.values()));
    writeJson(
        performanceDir.resolve("resource-waterfall.json"), reportBuilder.waterfall(scenarios.values()));
    reportBuilder
        .filmstrip(this.executionId, scenarios.values())
        .ifPresent(f -> writeJson(performanceDir.resolve("performance-filmstrip.json"), f));
    lastReport = report;
    log.info(
        "Performance collection for {} finalized: scenarios={}, score={}, grade={}",
        this.executionId,
        report.summary.totalScenarios,
        String.format(Locale.ROOT, "%.2f", report.summary.overallScore),
        report.summary.grade);
  }

  @Override
  public List<EvidencePayload> getEvidence() {
    return List.copyOf(evidence);
  }

  @Override
  public void clear() {
    shutdownProbes();
    scenarios.clear();
    probes.clear();
    evidence.clear();
  }

  public Optional<PerformanceReport> lastReport() {
    return Optional.ofNullable(lastReport);
  }

  public Optional<CoreWebVitals> latestVitals(String scenarioId) {
    return Optional.ofNullable(scenarios.get(scenarioId)).flatMap(ScenarioPerformance::latestVitals);
  }

  public Optional<PerformanceSummary> summary(String scenarioId) {
    return Optional.ofNullable(scenarios.get(scenarioId)).map(s -> s.summarise(scorer));
  }

  CoreWebVitals deriveVitals(PerformancePayload payload) {
    NavigationTiming nav = payload.navigation();
    VitalReading ttfb = nav == null ? VitalReading.notSupported() : measured(nav.ttfb());

    VitalReading inp = payload.inp();
    if (!inp.isAvailable() && !payload.interactionDurations().isEmpty()) {
      inp = measured(InteractivityMath.interactionToNextPaint(payload.interactionDurations()));
    }

    VitalReading tti = VitalReading.notSupported();
    VitalReading tbt = VitalReading.notSupported();
    if (nav != null) {
      double ttiValue = InteractivityMath.timeToInteractive(nav, payload.longTasks());
      tti = measured(ttiValue);
      tbt =
          measured(
              InteractivityMath.totalBlockingTime(
                  payload.longTasks(), payload.fcp().orElse(0), ttiValue));
    }

    VitalReading speedIndex = VitalReading.notSupported();
    VisualTimeline timeline = payload.visualTimeline();
    if (timeline != null && timeline.loadTime() <= 0 && nav != null) {
      timeline = new VisualTimeline(timeline.viewportArea(), nav.loadEventEnd(), timeline.events());
    }
    if (nav != null || timeline != null) {
      speedIndex = measured(SpeedIndexCalculator.speedIndex(timeline, payload.resources()));
    }

    return new CoreWebVitals(
        payload.timestamp(),
        payload.pageUrl(),
        payload.fcp(),
        payload.lcp(),
        payload.fid(),
        payload.cls(),
        ttfb,
        inp,
        tti,
        tbt,
        speedIndex);
  }

  /** Derived values are clamped at zero; a non-finite result is reported as not supported. */
  private static VitalReading measured(double value) {
    return Double.isFinite(value) ? VitalReading.of(Math.max(0, value)) : VitalReading.notSupported();
  }

  private Optional<PerformancePayload> capture(String scenarioId, BrowserProbe probe) {
    ExecutorService pool = probeExecutor;
    if (pool == null) {
      log.warn("Ignoring probe capture for scenario {}: engine is not running", scenarioId);
      return Optional.empty();
    }
    Duration timeout = cfg.getVitalsTimeout();
    Instant deadline = Instant.now().plus(timeout);
    try {
      return Optional.ofNullable(
          CompletableFuture.supplyAsync(() -> probe.capture(scenarioId, deadline), pool)
              .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
              .join());
    } catch (CompletionException e) {
      if (e.getCause() instanceof TimeoutException) {
        log.warn(
            "Browser probe for scenario {} did not answer within {}ms",
            scenarioId,
            timeout.toMillis());
      } else {
        log.warn("Browser probe for scenario {} failed", scenarioId, e.getCause());
      }
      return Optional.empty();
    }
  }

  private Optional<EvidencePayload> snapshot(ScenarioPerformance state, String reason) {
    PerformanceSummary summary = state.summarise(scorer);
    var snapshot =
        new PerformanceSnapshot(
            Instant.now(),
            state.scenarioId,
            reason,
            state.latestNavigation().orElse(null),
            state.resources.snapshot(),
            state.latestVitals().orElse(null),
            state.longTasks.snapshot(),
            state.memory.latest().orElse(null),
            state.userTimings(),
            state.budgetViolations(),
            summary);
    String fileName = "performance-" + reason + "-" + snapshot.timestamp().toEpochMilli() + ".json";
    try {
      byte[] content = mapper.writeValueAsBytes(snapshot);
      Files.write(performanceDir.resolve(fileName), content);
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("reason", reason);
      metadata.put("hasViolations", !summary.violations().isEmpty());
      metadata.put("webVitalsScore", summary.score());
      metadata.put("file", fileName);
      var payload =
          new EvidencePayload(
              EvidenceType.PERFORMANCE,
              "performance-" + reason,
              "Performance snapshot (" + reason + ")",
              content,
              null,
              null,
              metadata,
              List.of("performance", "snapshot", reason));
      evidence.add(payload);
      return Optional.of(payload);
    } catch (IOException e) {
      log.error("Failed to write performance snapshot {} for {}", fileName, state.scenarioId, e);
      return Optional.empty();
    }
  }

  private void shutdownProbes() {
    if (probeExecutor != null) {
      probeExecutor.shutdownNow();
      try {
        probeExecutor.awaitTermination(2, TimeUnit.SECONDS);
      } catch (InterruptedException ignored) {
        Thread.currentThread().interrupt();
      }
      probeExecutor = null;
    }
  }

  private void writeJson(Path file, Object value) {
    try {
      Files.write(file, mapper.writeValueAsBytes(value));
    } catch (IOException e) {
      log.error("Failed to write {}", file, e);
    }
  }
}
