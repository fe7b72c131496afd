package com.mk.fx.qa.evidence.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.evidence.model.EvidenceArchive;
import com.mk.fx.qa.evidence.model.EvidenceItem;
import com.mk.fx.qa.evidence.model.EvidenceManifest;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes gzip-compressed JSON archives of completed collections and reads them back.
 *
 * <p>The archive references the evidence files by path; their bytes stay where they are unless
 * delete-after-archive is enabled.
 */
@Slf4j
final class EvidenceArchiver {

  static final String DIRECTORY = "archives";
  static final String SUFFIX = ".json.gz";

  private final Path root;
  private final ObjectMapper mapper;
  private final EvidenceFileWriter files;
  private final ManifestWriter manifests;

  EvidenceArchiver(Path root, ObjectMapper mapper, EvidenceFileWriter files, ManifestWriter manifests) {
    this.root = root;
    this.mapper = mapper;
    this.files = files;
    this.manifests = manifests;
  }

  Path directory() {
    return root.resolve(DIRECTORY);
  }

  /**
   * Archives {@code manifest} to {@code archives/<executionId>_<epochMillis>.json.gz}.
   *
   * @param deleteSources delete the manifest and every archived evidence file afterwards
   * @throws UncheckedIOException when the archive cannot be written
   */
  Path archive(EvidenceManifest manifest, boolean deleteSources) {
    Instant createdAt = Instant.now();
    List<String> archived = new ArrayList<>();
    Path manifestFile = manifests.path(manifest.executionId());
    if (Files.isRegularFile(manifestFile)) {
      archived.add(manifestFile.getFileName().toString());
    }
    for (EvidenceItem item : manifest.items()) {
      if (item.persisted() && Files.isRegularFile(files.resolve(item.path()))) {
        archived.add(item.path());
      }
    }

    var document = new EvidenceArchive(manifest.executionId(), createdAt, archived, manifest);
    Path target =
        directory().resolve(manifest.executionId() + "_" + createdAt.toEpochMilli() + SUFFIX);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, EvidenceFileWriter.gzip(mapper.writeValueAsBytes(document)));
      log.info(
          "Archived evidence of {} to {} ({} bytes, {} files)",
          manifest.executionId(),
          target,
          Files.size(target),
          archived.size());
    } catch (IOException e) {
      throw new UncheckedIOException("Archive creation failed for " + manifest.executionId(), e);
    }

    if (deleteSources) {
      for (String relative : archived) {
        try {
          Files.deleteIfExists(files.resolve(relative));
        } catch (IOException e) {
          log.warn("Failed to delete archived file {}: {}", relative, e.getMessage());
        }
      }
    }
    return target;
  }

  /**
   * Reads {@code archivePath} and writes its manifest as {@code manifest_<executionId>.json} into
   * {@code targetDir}.
   *
   * @return the written manifest path
   */
  Path extract(Path archivePath, Path targetDir) throws IOException {
    var document =
        mapper.readValue(
            EvidenceFileWriter.gunzip(Files.readAllBytes(archivePath)), EvidenceArchive.class);
    Files.createDirectories(targetDir);
    Path target =
        targetDir.resolve(ManifestWriter.PREFIX + document.executionId() + ManifestWriter.SUFFIX);
    Files.write(target, mapper.writeValueAsBytes(document.collection()));
    log.info("Extracted archive {} to {}", archivePath, target);
    return target;
  }
}
