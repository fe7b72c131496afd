package com.mk.fx.qa.evidence.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw evidence handed over by a collector, before the store persists it and turns it into an
 * {@link EvidenceItem}.
 *
 * @param type evidence kind
 * @param name display name, may be null
 * @param description free text, may be null
 * @param content bytes to persist; an empty array means nothing to write
 * @param extension file extension override including the dot, or null for the type default
 * @param format format override, or null for the type default
 * @param metadata collector supplied metadata
 * @param tags collector supplied tags
 */
public record EvidencePayload(
    EvidenceType type,
    String name,
    String description,
    byte[] content,
    String extension,
    String format,
    Map<String, Object> metadata,
    List<String> tags) {

  public EvidencePayload {
    Objects.requireNonNull(type, "type");
    content = content == null ? new byte[0] : content;
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static EvidencePayload of(
      EvidenceType type, String name, byte[] content, Map<String, Object> metadata, List<String> tags) {
    return new EvidencePayload(type, name, null, content, null, null, metadata, tags);
  }

  public boolean hasContent() {
    return content.length > 0;
  }
}
