package com.mk.fx.qa.evidence.store;

import com.mk.fx.qa.evidence.model.EvidenceItem;
import com.mk.fx.qa.evidence.model.EvidenceManifest;
import com.mk.fx.qa.evidence.model.RetentionResult;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * Deletes collections and archives older than the retention window.
 *
 * <p>Age is the last-modified time of the manifest or archive file. Per-file failures are logged
 * and skipped.
 */
@Slf4j
final class RetentionCleaner {

  private final Path root;
  private final EvidenceFileWriter files;
  private final ManifestWriter manifests;
  private final EvidenceArchiver archiver;

  RetentionCleaner(
      Path root, EvidenceFileWriter files, ManifestWriter manifests, EvidenceArchiver archiver) {
    this.root = root;
    this.files = files;
    this.manifests = manifests;
    this.archiver = archiver;
  }

  RetentionResult clean(int retentionDays, Instant now) {
    Instant cutoff = now.minus(Duration.ofDays(retentionDays));
    int manifestsRemoved = 0;
    int filesRemoved = 0;
    int archivesRemoved = 0;

    if (Files.isDirectory(root)) {
      try (DirectoryStream<Path> stream =
          Files.newDirectoryStream(root, ManifestWriter.PREFIX + "*" + ManifestWriter.SUFFIX)) {
        for (Path manifestFile : stream) {
          if (!olderThan(manifestFile, cutoff)) {
            continue;
          }
          String executionId = executionIdOf(manifestFile);
          var manifest = manifests.read(executionId);
          if (manifest.isPresent()) {
            filesRemoved += deleteItems(manifest.get());
          }
          if (delete(manifestFile)) {
            manifestsRemoved++;
            log.info("Removed expired evidence collection {}", executionId);
          }
        }
      } catch (IOException e) {
        log.error("Failed to scan {} for expired manifests", root, e);
      }
    }

    Path archives = archiver.directory();
    if (Files.isDirectory(archives)) {
      try (DirectoryStream<Path> stream = Files.newDirectoryStream(archives)) {
        for (Path archive : stream) {
          if (olderThan(archive, cutoff) && delete(archive)) {
            archivesRemoved++;
            log.info("Removed expired archive {}", archive.getFileName());
          }
        }
      } catch (IOException e) {
        log.error("Failed to scan {} for expired archives", archives, e);
      }
    }

    return new RetentionResult(cutoff, manifestsRemoved, filesRemoved, archivesRemoved);
  }

  private int deleteItems(EvidenceManifest manifest) {
    int removed = 0;
    for (EvidenceItem item : manifest.items()) {
      if (files.delete(item)) {
        removed++;
      }
    }
    return removed;
  }

  private static boolean olderThan(Path file, Instant cutoff) {
    try {
      return Files.getLastModifiedTime(file).toInstant().isBefore(cutoff);
    } catch (IOException e) {
      log.warn("Cannot read modification time of {}: {}", file, e.getMessage());
      return false;
    }
  }

  private static boolean delete(Path file) {
    try {
      return Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Failed to delete {}: {}", file, e.getMessage());
      return false;
    }
  }

  private static String executionIdOf(Path manifestFile) {
    String name = manifestFile.getFileName().toString();
    return name.substring(
        ManifestWriter.PREFIX.length(), name.length() - ManifestWriter.SUFFIX.length());
  }
}
