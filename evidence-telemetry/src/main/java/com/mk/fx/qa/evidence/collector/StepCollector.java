package com.mk.fx.qa.evidence.collector;

import com.mk.fx.qa.evidence.model.EvidencePayload;
import com.mk.fx.qa.evidence.model.StepStatus;
import java.util.List;

/** Optional capability: collectors that also react to individual steps. */
public interface StepCollector extends Collector {

  List<EvidencePayload> collectForStep(
      String scenarioId, String stepId, String stepText, StepStatus status);
}
