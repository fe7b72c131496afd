package com.mk.fx.qa.evidence.collector;

import com.mk.fx.qa.evidence.model.EvidencePayload;
import com.mk.fx.qa.evidence.model.EvidenceType;
import java.util.List;

/**
 * Uniform lifecycle every evidence source implements.
 *
 * <p>One instance serves one execution. Implementations must tolerate concurrent
 * {@link #collectForScenario} calls for different scenarios of that execution.
 */
public interface Collector {

  EvidenceType type();

  /**
   * Prepares the collector for an execution.
   *
   * @throws java.io.UncheckedIOException if the collector's output location cannot be created
   */
  void initialize(String executionId, CollectorOptions options);

  List<EvidencePayload> collectForScenario(String scenarioId, String scenarioName);

  /** Writes terminal reports and releases execution resources. */
  void finalize(String executionId);

  /** Evidence currently held in memory, without side effects. */
  List<EvidencePayload> getEvidence();

  void clear();
}
