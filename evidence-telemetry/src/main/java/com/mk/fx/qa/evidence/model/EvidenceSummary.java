package com.mk.fx.qa.evidence.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derived projection of a collection's items.
 *
 * @param byType item counts keyed by {@link EvidenceType#key()}
 * @param duration milliseconds between start and end, 0 while collecting
 */
public record EvidenceSummary(
    int totalItems, Map<String, Integer> byType, long totalSize, long duration) {

  public EvidenceSummary {
    byType = byType == null ? Map.of() : Map.copyOf(byType);
  }

  public static EvidenceSummary of(Collection<EvidenceItem> items, long duration) {
    Map<String, Integer> byType = new LinkedHashMap<>();
    for (EvidenceType type : EvidenceType.values()) {
      byType.put(type.key(), 0);
    }
    long size = 0;
    for (EvidenceItem item : items) {
      byType.merge(item.type().key(), 1, Integer::sum);
      size += item.size();
    }
    return new EvidenceSummary(items.size(), byType, size, duration);
  }

  public int count(EvidenceType type) {
    return byType.getOrDefault(type.key(), 0);
  }
}
