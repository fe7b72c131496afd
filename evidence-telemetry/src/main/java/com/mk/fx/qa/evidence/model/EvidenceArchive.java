package com.mk.fx.qa.evidence.model;

import java.time.Instant;
import java.util.List;

/**
 * Content of {@code archives/<executionId>_<ts>.json.gz}.
 *
 * @param files root-relative paths of the files the archive covers, manifest first
 * @param collection the manifest as it was at archive time
 */
public record EvidenceArchive(
    String executionId, Instant createdAt, List<String> files, EvidenceManifest collection) {

  public EvidenceArchive {
    files = files == null ? List.of() : List.copyOf(files);
  }
}
