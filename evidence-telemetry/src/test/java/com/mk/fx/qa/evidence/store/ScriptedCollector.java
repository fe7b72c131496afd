package com.mk.fx.qa.evidence.store;

import com.mk.fx.qa.evidence.collector.Collector;
import com.mk.fx.qa.evidence.collector.CollectorFactory;
import com.mk.fx.qa.evidence.collector.CollectorOptions;
import com.mk.fx.qa.evidence.collector.StepCollector;
import com.mk.fx.qa.evidence.model.EvidencePayload;
import com.mk.fx.qa.evidence.model.EvidenceType;
import com.mk.fx.qa.evidence.model.StepStatus;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Step collector returning canned payloads and recording the calls it received. */
class ScriptedCollector implements StepCollector {

  final EvidenceType type;
  final List<String> calls = new CopyOnWriteArrayList<>();
  final List<byte[]> scenarioContent = new ArrayList<>();
  boolean failInitialize;
  boolean failCollect;
  boolean failFinalize;
  volatile boolean cleared;
  final CountDownLatch scenarioEntered = new CountDownLatch(1);
  private volatile CountDownLatch scenarioGate;

  ScriptedCollector(EvidenceType type) {
    this.type = type;
  }

  ScriptedCollector returning(String... contents) {
    for (String content : contents) {
      scenarioContent.add(content.getBytes(StandardCharsets.UTF_8));
    }
    return this;
  }

  ScriptedCollector returning(byte[] content) {
    scenarioContent.add(content);
    return this;
  }

  /** Scenario calls block until {@link #release()}. */
  ScriptedCollector holdingScenarios() {
    scenarioGate = new CountDownLatch(1);
    return this;
  }

  void release() {
    scenarioGate.countDown();
  }

  @Override
  public EvidenceType type() {
    return type;
  }

  @Override
  public void initialize(String executionId, CollectorOptions options) {
    calls.add("initialize:" + executionId);
    if (failInitialize) {
      throw new IllegalStateException(type.key() + " cannot start");
    }
  }

  @Override
  public List<EvidencePayload> collectForScenario(String scenarioId, String scenarioName) {
    calls.add("scenario:" + scenarioId);
    scenarioEntered.countDown();
    CountDownLatch gate = scenarioGate;
    if (gate != null) {
      try {
        if (!gate.await(10, TimeUnit.SECONDS)) {
          throw new IllegalStateException(type.key() + " was never released");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(type.key() + " interrupted", e);
      }
    }
    if (failCollect) {
      throw new IllegalStateException(type.key() + " unavailable");
    }
    List<EvidencePayload> out = new ArrayList<>();
    for (byte[] content : scenarioContent) {
      out.add(
          EvidencePayload.of(
              type, type.key() + "-" + scenarioId, content, Map.of("source", "scripted"),
              List.of(type.key(), scenarioId)));
    }
    return out;
  }

  @Override
  public List<EvidencePayload> collectForStep(
      String scenarioId, String stepId, String stepText, StepStatus status) {
    calls.add("step:" + stepId + ":" + status.key());
    if (failCollect) {
      throw new IllegalStateException(type.key() + " unavailable");
    }
    return List.of(
        EvidencePayload.of(
            type,
            type.key() + "-" + stepId,
            (stepText + " " + status.key()).getBytes(StandardCharsets.UTF_8),
            Map.of(),
            List.of("step")));
  }

  @Override
  public void finalize(String executionId) {
    calls.add("finalize:" + executionId);
    if (failFinalize) {
      throw new IllegalStateException(type.key() + " cannot finalize");
    }
  }

  @Override
  public List<EvidencePayload> getEvidence() {
    return List.of();
  }

  @Override
  public void clear() {
    cleared = true;
  }

  /** Factory handing out one shared collector so tests can inspect it. */
  static CollectorFactory factory(ScriptedCollector collector) {
    return new CollectorFactory() {
      @Override
      public EvidenceType type() {
        return collector.type;
      }

      @Override
      public Collector create() {
        return collector;
      }
    };
  }
}
