package com.mk.fx.qa.evidence.model;

import java.time.Instant;
import java.util.Set;

/**
 * Narrows a collection view. Empty sets and null bounds match everything.
 *
 * @param tags an item matches when it carries at least one of these tags
 */
public record EvidenceFilter(
    Set<EvidenceType> types, Set<String> scenarioIds, Set<String> tags, Instant start, Instant end) {

  public static final EvidenceFilter NONE = new EvidenceFilter(Set.of(), Set.of(), Set.of(), null, null);

  public EvidenceFilter {
    types = types == null ? Set.of() : Set.copyOf(types);
    scenarioIds = scenarioIds == null ? Set.of() : Set.copyOf(scenarioIds);
    tags = tags == null ? Set.of() : Set.copyOf(tags);
  }

  public boolean matches(EvidenceItem item) {
    if (!types.isEmpty() && !types.contains(item.type())) {
      return false;
    }
    if (!scenarioIds.isEmpty() && !scenarioIds.contains(item.scenarioId())) {
      return false;
    }
    if (!tags.isEmpty() && item.tags().stream().noneMatch(tags::contains)) {
      return false;
    }
    if (start != null && item.timestamp().isBefore(start)) {
      return false;
    }
    return end == null || !item.timestamp().isAfter(end);
  }
}
