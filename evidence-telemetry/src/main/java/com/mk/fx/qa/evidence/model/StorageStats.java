package com.mk.fx.qa.evidence.model;

import java.util.Map;

/**
 * Disk usage under the evidence root.
 *
 * @param byDirectory usage keyed by type directory name
 */
public record StorageStats(
    long totalFiles, long totalBytes, int archives, int manifests, Map<String, DirectoryUsage> byDirectory) {

  public record DirectoryUsage(long files, long bytes) {}
}
