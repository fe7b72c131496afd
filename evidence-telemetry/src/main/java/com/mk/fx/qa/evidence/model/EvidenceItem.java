package com.mk.fx.qa.evidence.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One persisted artifact tied to a scenario or step.
 *
 * @param path location relative to the evidence root, null when nothing could be written
 * @param size bytes on disk after compression
 */
public record EvidenceItem(
    String id,
    EvidenceType type,
    String scenarioId,
    String stepId,
    String name,
    String description,
    Instant timestamp,
    String path,
    long size,
    Map<String, Object> metadata,
    List<String> tags) {

  public EvidenceItem {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public boolean compressed() {
    return Boolean.TRUE.equals(metadata.get("compressed"));
  }

  public boolean persisted() {
    return path != null;
  }
}
