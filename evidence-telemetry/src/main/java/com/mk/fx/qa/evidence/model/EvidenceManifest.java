package com.mk.fx.qa.evidence.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted descriptor of a collection plus SHA-256 checksums keyed by item id.
 */
public record EvidenceManifest(
    String executionId,
    Instant startTime,
    Instant endTime,
    Map<String, Object> metadata,
    List<EvidenceItem> items,
    EvidenceSummary summary,
    Map<String, String> checksums,
    String version,
    Instant generated) {

  public static final String VERSION = "1.0";

  public EvidenceManifest {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    items = items == null ? List.of() : List.copyOf(items);
    checksums = checksums == null ? Map.of() : Map.copyOf(checksums);
  }

  public CollectionView toView() {
    return new CollectionView(executionId, startTime, endTime, metadata, items, summary);
  }
}
