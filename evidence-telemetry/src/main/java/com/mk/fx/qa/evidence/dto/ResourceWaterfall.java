package com.mk.fx.qa.evidence.dto;

import java.util.List;
import java.util.Map;

/** Per-scenario request timeline, written as {@code resource-waterfall.json}. */
public record ResourceWaterfall(String scenarioId, double startTime, List<Entry> entries) {

  /**
   * @param phases named phases (dns, tcp, ssl, request, response, dom, load); phases that did not
   *     happen are left out
   */
  public record Entry(
      String name,
      String type,
      double startTime,
      double duration,
      long size,
      boolean cached,
      Map<String, Phase> phases) {}

  public record Phase(double start, double end) {}
}
