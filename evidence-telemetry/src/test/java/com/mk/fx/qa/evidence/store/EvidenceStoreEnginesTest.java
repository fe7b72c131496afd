package com.mk.fx.qa.evidence.store;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.evidence.cfg.EvidenceStoreCfg;
import com.mk.fx.qa.evidence.cfg.MetricsCfg;
import com.mk.fx.qa.evidence.cfg.ObjectMapperConfig;
import com.mk.fx.qa.evidence.cfg.PerformanceCfg;
import com.mk.fx.qa.evidence.metrics.MetricsCollectorFactory;
import com.mk.fx.qa.evidence.metrics.MetricsEngine;
import com.mk.fx.qa.evidence.model.CollectionView;
import com.mk.fx.qa.evidence.model.EvidenceItem;
import com.mk.fx.qa.evidence.model.EvidenceType;
import com.mk.fx.qa.evidence.model.StepStatus;
import com.mk.fx.qa.evidence.performance.NavigationTiming;
import com.mk.fx.qa.evidence.performance.PerformanceCollectorFactory;
import com.mk.fx.qa.evidence.performance.PerformanceEngine;
import com.mk.fx.qa.evidence.performance.PerformancePayload;
import com.mk.fx.qa.evidence.performance.VitalReading;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Drives the store with the real metrics and performance engines. */
class EvidenceStoreEnginesTest {

  private static final String EXEC = "exec-engines";

  @TempDir Path root;

  private EvidenceStore store;

  @BeforeEach
  void setUp() {
    ObjectMapper mapper = ObjectMapperConfig.evidenceMapper();
    var storeCfg = new EvidenceStoreCfg();
    storeCfg.setPath(root.toString());
    var metricsCfg = new MetricsCfg();
    metricsCfg.setCollectSystemMetrics(false);
    store =
        new EvidenceStore(
            storeCfg,
            List.of(
                new MetricsCollectorFactory(metricsCfg, mapper),
                new PerformanceCollectorFactory(new PerformanceCfg(), mapper)),
            mapper);
    store.initialise();
  }

  @AfterEach
  void tearDown() {
    store.shutdown();
  }

  @Test
  void fullExecution_producesSnapshotsAndReports() {
    store.startCollection(EXEC);
    List<EvidenceItem> scenarioItems = store.collectForScenario(EXEC, "scn-1", "Checkout");

    assertEquals(
        List.of(EvidenceType.METRICS), scenarioItems.stream().map(EvidenceItem::type).toList());

    PerformanceEngine performance =
        store.findCollector(EXEC, PerformanceEngine.class).orElseThrow();
    performance.recordPayload(
        "scn-1",
        PerformancePayload.builder()
            .navigation(
                NavigationTiming.builder()
                    .url("https://shop.example.com/checkout")
                    .responseStart(150)
                    .responseEnd(300)
                    .loadEventEnd(1500)
                    .build())
            .lcp(VitalReading.of(6000))
            .build());
    assertTrue(store.findCollector(EXEC, MetricsEngine.class).isPresent());

    assertTrue(store.collectForStep(EXEC, "scn-1", "s1", "pay", StepStatus.PASSED).isEmpty());
    List<EvidenceItem> failed =
        store.collectForStep(EXEC, "scn-1", "s1", "pay", StepStatus.FAILED);

    assertEquals(
        Set.of(EvidenceType.METRICS, EvidenceType.PERFORMANCE),
        Set.copyOf(failed.stream().map(EvidenceItem::type).toList()));

    CollectionView view = store.completeCollection(EXEC);

    assertEquals(3, view.summary().totalItems());
    assertTrue(Files.exists(root.resolve("metrics").resolve(EXEC).resolve("metrics-report.json")));
    assertTrue(
        Files.exists(root.resolve("performance").resolve(EXEC).resolve("performance-report.json")));
    assertTrue(Files.exists(root.resolve("manifest_" + EXEC + ".json")));
  }
}
