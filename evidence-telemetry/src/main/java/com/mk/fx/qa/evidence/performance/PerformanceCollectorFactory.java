package com.mk.fx.qa.evidence.performance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.evidence.cfg.PerformanceCfg;
import com.mk.fx.qa.evidence.collector.Collector;
import com.mk.fx.qa.evidence.collector.CollectorFactory;
import com.mk.fx.qa.evidence.model.EvidenceType;
import org.springframework.stereotype.Component;

/** Creates one {@link PerformanceEngine} per execution. */
@Component
public class PerformanceCollectorFactory implements CollectorFactory {

  private final PerformanceCfg cfg;
  private final ObjectMapper mapper;

  public PerformanceCollectorFactory(PerformanceCfg cfg, ObjectMapper mapper) {
    this.cfg = cfg;
    this.mapper = mapper;
  }

  @Override
  public EvidenceType type() {
    return EvidenceType.PERFORMANCE;
  }

  @Override
  public Collector create() {
    return new PerformanceEngine(cfg, mapper);
  }
}
