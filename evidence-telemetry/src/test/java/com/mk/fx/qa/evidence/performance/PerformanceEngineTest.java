package com.mk.fx.qa.evidence.performance;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.evidence.cfg.ObjectMapperConfig;
import com.mk.fx.qa.evidence.cfg.PerformanceCfg;
import com.mk.fx.qa.evidence.collector.CollectorOptions;
import com.mk.fx.qa.evidence.model.EvidencePayload;
import com.mk.fx.qa.evidence.model.EvidenceType;
import com.mk.fx.qa.evidence.model.StepStatus;
import java.awt.Color;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PerformanceEngineTest {

  private static final String EXEC = "exec-1";
  private static final String SCN = "scn-1";

  @TempDir Path root;

  private PerformanceCfg cfg;
  private PerformanceEngine engine;

  @BeforeEach
  void setUp() {
    cfg = new PerformanceCfg();
    cfg.setVitalsTimeout(Duration.ofMillis(200));
    engine = new PerformanceEngine(cfg, ObjectMapperConfig.evidenceMapper());
  }

  @AfterEach
  void tearDown() {
    engine.clear();
  }

  private static PerformancePayload payload() {
    return PerformancePayload.builder()
        .url("https://app.example.com/login")
        .navigation(
            NavigationTiming.builder()
                .url("https://app.example.com/login")
                .fetchStart(0)
                .responseStart(200)
                .responseEnd(400)
                .domContentLoadedEventEnd(900)
                .domComplete(1800)
                .loadEventEnd(2000)
                .build())
        .fcp(VitalReading.of(500))
        .lcp(VitalReading.of(5000))
        .fid(VitalReading.timedOut())
        .cls(VitalReading.of(0.02))
        .interactionDurations(List.of(40.0, 120.0))
        .longTasks(List.of(new LongTask(1000, 150, null)))
        .build();
  }

  private Path performanceDir() {
    return root.resolve(EvidenceType.PERFORMANCE.directory()).resolve(EXEC);
  }

  @Test
  void recordPayload_derivesInteractivityVitals() {
    engine.initialize(EXEC, CollectorOptions.rootedAt(root));

    CoreWebVitals vitals = engine.recordPayload(SCN, payload());

    assertEquals(200, vitals.ttfb().value(), 1e-9);
    assertEquals(6150, vitals.tti().value(), 1e-9);
    assertEquals(100, vitals.tbt().value(), 1e-9);
    assertEquals(120, vitals.inp().value(), 1e-9);
    assertEquals(0, vitals.speedIndex().value(), 1e-9);
    assertEquals(VitalStatus.TIMED_OUT, vitals.fid().status());
    assertEquals("https://app.example.com/login", vitals.url());
    assertTrue(engine.latestVitals(SCN).isPresent());
  }

  @Test
  void deriveVitals_noNavigation_interactivityNotSupported() {
    var vitals = engine.deriveVitals(PerformancePayload.builder().fcp(VitalReading.of(100)).build());

    assertEquals(VitalStatus.NOT_SUPPORTED, vitals.ttfb().status());
    assertEquals(VitalStatus.NOT_SUPPORTED, vitals.tti().status());
    assertEquals(VitalStatus.NOT_SUPPORTED, vitals.speedIndex().status());
  }

  @Test
  void collectForStep_failedWithCaptures_writesSnapshot() {
    engine.initialize(EXEC, CollectorOptions.rootedAt(root));
    engine.collectForScenario(SCN, "Login");
    engine.attachProbe(SCN, (scenarioId, deadline) -> payload());

    assertTrue(engine.collectForStep(SCN, "s1", "open page", StepStatus.PASSED).isEmpty());
    List<EvidencePayload> out = engine.collectForStep(SCN, "s2", "submit", StepStatus.FAILED);

    assertEquals(1, out.size());
    EvidencePayload snapshot = out.get(0);
    assertEquals(EvidenceType.PERFORMANCE, snapshot.type());
    assertEquals("performance-step-failed-s2", snapshot.name());
    assertEquals(Boolean.TRUE, snapshot.metadata().get("hasViolations"));
    assertTrue(Files.exists(performanceDir().resolve((String) snapshot.metadata().get("file"))));
    assertEquals(1, engine.getEvidence().size());
  }

  @Test
  void collectForStep_invalidInteractionDurations_stillSnapshotsFailedStep() {
    engine.initialize(EXEC, CollectorOptions.rootedAt(root));
    engine.collectForScenario(SCN, "Login");
    engine.attachProbe(
        SCN,
        (scenarioId, deadline) ->
            PerformancePayload.builder()
                .navigation(NavigationTiming.builder().responseStart(120).responseEnd(300).build())
                .lcp(VitalReading.of(1800))
                .interactionDurations(List.of(-5.0, Double.NaN, 60.0))
                .build());

    List<EvidencePayload> out = engine.collectForStep(SCN, "s1", "submit", StepStatus.FAILED);

    assertEquals(1, out.size());
    assertEquals("performance-step-failed-s1", out.get(0).name());
    assertEquals(60, engine.latestVitals(SCN).orElseThrow().inp().value(), 1e-9);
  }

  @Test
  void deriveVitals_onlyInvalidInteractionDurations_inpIsZero() {
    var vitals =
        engine.deriveVitals(
            PerformancePayload.builder()
                .interactionDurations(List.of(-1.0, Double.POSITIVE_INFINITY))
                .build());

    assertEquals(0, vitals.inp().value(), 1e-9);
  }

  @Test
  void collectForStep_failedWithoutCaptures_returnsNothing() {
    engine.initialize(EXEC, CollectorOptions.rootedAt(root));
    engine.collectForScenario(SCN, "Login");

    assertTrue(engine.collectForStep(SCN, "s1", "submit", StepStatus.FAILED).isEmpty());
  }

  @Test
  void collectForStep_probeTooSlow_captureDropped() {
    engine.initialize(EXEC, CollectorOptions.rootedAt(root));
    engine.collectForScenario(SCN, "Login");
    engine.attachProbe(
        SCN,
        (scenarioId, deadline) -> {
          try {
            Thread.sleep(5_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return payload();
        });

    long started = System.nanoTime();
    var out = engine.collectForStep(SCN, "s1", "wait", StepStatus.PASSED);

    assertTrue(out.isEmpty());
    assertTrue(engine.latestVitals(SCN).isEmpty());
    assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() < 4_000);
  }

  @Test
  void collectForStep_probeThrows_stepStillCompletes() {
    engine.initialize(EXEC, CollectorOptions.rootedAt(root));
    engine.collectForScenario(SCN, "Login");
    engine.attachProbe(
        SCN,
        (scenarioId, deadline) -> {
          throw new IllegalStateException("page closed");
        });

    assertTrue(engine.collectForStep(SCN, "s1", "open", StepStatus.PASSED).isEmpty());
    assertTrue(engine.latestVitals(SCN).isEmpty());
  }

  @Test
  void finalize_writesReportFiles() {
    engine.initialize(EXEC, CollectorOptions.rootedAt(root));
    engine.collectForScenario(SCN, "Login");
    engine.recordPayload(SCN, payload());

    engine.finalize(EXEC);

    assertTrue(Files.exists(performanceDir().resolve("performance-report.json")));
    assertTrue(Files.exists(performanceDir().resolve("performance-analysis.json")));
    assertTrue(Files.exists(performanceDir().resolve("resource-waterfall.json")));
    assertFalse(Files.exists(performanceDir().resolve("performance-filmstrip.json")));
    var report = engine.lastReport().orElseThrow();
    assertEquals(EXEC, report.executionId);
    assertEquals(1, report.summary.totalScenarios);
  }

  @Test
  void finalize_withFrames_writesFilmstrip() {
    engine.initialize(EXEC, CollectorOptions.rootedAt(root));
    byte[] blank = FilmstripBuilderTest.png(FilmstripBuilderTest.split(Color.WHITE, Color.BLACK));
    byte[] done = FilmstripBuilderTest.png(FilmstripBuilderTest.split(Color.BLACK, Color.WHITE));
    var withFrames =
        PerformancePayload.builder()
            .url("https://app.example.com/")
            .fcp(VitalReading.of(300))
            .frames(List.of(new ScreenFrame(0, blank), new ScreenFrame(500, done)))
            .build();
    engine.recordPayload(SCN, withFrames);

    engine.finalize(EXEC);

    assertTrue(Files.exists(performanceDir().resolve("performance-filmstrip.json")));
  }

  @Test
  void finalize_withoutInitialize_isNoop() {
    engine.finalize(EXEC);
    assertTrue(engine.lastReport().isEmpty());
  }
}
