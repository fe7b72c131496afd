package com.mk.fx.qa.evidence.store;

import static com.mk.fx.qa.evidence.utils.EvidenceUtils.sha256Hex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.evidence.model.CollectionView;
import com.mk.fx.qa.evidence.model.EvidenceItem;
import com.mk.fx.qa.evidence.model.EvidenceManifest;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Writes and reads {@code manifest_<executionId>.json} in the evidence root. */
@Slf4j
final class ManifestWriter {

  static final String PREFIX = "manifest_";
  static final String SUFFIX = ".json";

  private final Path root;
  private final ObjectMapper mapper;
  private final EvidenceFileWriter files;

  ManifestWriter(Path root, ObjectMapper mapper, EvidenceFileWriter files) {
    this.root = root;
    this.mapper = mapper;
    this.files = files;
  }

  Path path(String executionId) {
    return root.resolve(PREFIX + executionId + SUFFIX);
  }

  /**
   * Checksums every persisted item and writes the manifest.
   *
   * @throws UncheckedIOException when the manifest itself cannot be written
   */
  EvidenceManifest write(CollectionView view) {
    var manifest =
        new EvidenceManifest(
            view.executionId(),
            view.startTime(),
            view.endTime(),
            view.metadata(),
            view.items(),
            view.summary(),
            checksums(view),
            EvidenceManifest.VERSION,
            Instant.now());
    Path target = path(view.executionId());
    try {
      Files.createDirectories(root);
      Files.write(target, mapper.writeValueAsBytes(manifest));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write manifest " + target, e);
    }
    log.info(
        "Manifest written for {}: items={}, checksums={}",
        view.executionId(),
        manifest.items().size(),
        manifest.checksums().size());
    return manifest;
  }

  Optional<EvidenceManifest> read(String executionId) {
    Path source = path(executionId);
    if (!Files.isRegularFile(source)) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(source.toFile(), EvidenceManifest.class));
    } catch (IOException e) {
      log.warn("Unreadable manifest {}: {}", source, e.getMessage());
      return Optional.empty();
    }
  }

  private Map<String, String> checksums(CollectionView view) {
    Map<String, String> checksums = new LinkedHashMap<>();
    for (EvidenceItem item : view.items()) {
      if (!item.persisted()) {
        continue;
      }
      Path file = files.resolve(item.path());
      if (!Files.isRegularFile(file)) {
        log.warn("Evidence file {} of item {} is missing, no checksum recorded", file, item.id());
        continue;
      }
      try {
        checksums.put(item.id(), sha256Hex(Files.readAllBytes(file)));
      } catch (IOException e) {
        log.warn("Cannot checksum {}: {}", file, e.getMessage());
      }
    }
    return checksums;
  }
}
