package com.mk.fx.qa.evidence.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Immutable snapshot of an {@link EvidenceCollection}, or of a filtered subset of it. */
public record CollectionView(
    String executionId,
    Instant startTime,
    Instant endTime,
    Map<String, Object> metadata,
    List<EvidenceItem> items,
    EvidenceSummary summary) {

  public CollectionView {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    items = items == null ? List.of() : List.copyOf(items);
  }
}
