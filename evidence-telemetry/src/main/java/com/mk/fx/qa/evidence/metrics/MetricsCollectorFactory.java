package com.mk.fx.qa.evidence.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.evidence.cfg.MetricsCfg;
import com.mk.fx.qa.evidence.collector.Collector;
import com.mk.fx.qa.evidence.collector.CollectorFactory;
import com.mk.fx.qa.evidence.model.EvidenceType;
import org.springframework.stereotype.Component;

/** Creates one {@link MetricsEngine} per execution. */
@Component
public class MetricsCollectorFactory implements CollectorFactory {

  private final MetricsCfg cfg;
  private final ObjectMapper mapper;

  public MetricsCollectorFactory(MetricsCfg cfg, ObjectMapper mapper) {
    this.cfg = cfg;
    this.mapper = mapper;
  }

  @Override
  public EvidenceType type() {
    return EvidenceType.METRICS;
  }

  @Override
  public Collector create() {
    return new MetricsEngine(cfg, new JvmSystemSampleSource(), mapper);
  }
}
