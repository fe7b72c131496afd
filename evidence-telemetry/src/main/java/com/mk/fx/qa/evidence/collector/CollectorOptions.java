package com.mk.fx.qa.evidence.collector;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-execution settings passed to {@link Collector#initialize}.
 *
 * @param evidenceRoot root directory all collectors write below
 * @param metadata free-form execution attributes (environment, browser, viewport)
 * @param tags tags attached to the execution
 */
public record CollectorOptions(Path evidenceRoot, Map<String, Object> metadata, List<String> tags) {

  public CollectorOptions {
    Objects.requireNonNull(evidenceRoot, "evidenceRoot");
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static CollectorOptions rootedAt(Path evidenceRoot) {
    return new CollectorOptions(evidenceRoot, Map.of(), List.of());
  }

  /** Directory {@code <root>/<area>/<executionId>}. */
  public Path executionDirectory(String area, String executionId) {
    return evidenceRoot.resolve(area).resolve(executionId);
  }
}
