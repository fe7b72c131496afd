package com.mk.fx.qa.evidence.dto;

import java.time.Instant;
import java.util.List;

/** Visual progression of each scenario's page load, written as {@code performance-filmstrip.json}. */
public record Filmstrip(String executionId, Instant timestamp, List<ScenarioFilmstrip> scenarios) {

  public record ScenarioFilmstrip(
      String scenarioId, String url, List<Frame> frames, List<KeyFrame> keyFrames, double speedIndex) {}

  /** @param visualCompleteness 0..100 */
  public record Frame(int index, double timestamp, byte[] image, double visualCompleteness) {}

  /** @param type start, first-visual-change or visually-complete-50/85/95/100 */
  public record KeyFrame(int index, String type, double timestamp) {}
}
