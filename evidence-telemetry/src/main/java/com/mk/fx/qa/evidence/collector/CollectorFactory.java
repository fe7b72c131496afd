package com.mk.fx.qa.evidence.collector;

import com.mk.fx.qa.evidence.model.EvidenceType;

/**
 * Spring-registered source of collectors. The store asks every factory for a fresh collector when
 * an execution starts, so no collector state is shared between executions.
 */
public interface CollectorFactory {

  EvidenceType type();

  Collector create();
}
