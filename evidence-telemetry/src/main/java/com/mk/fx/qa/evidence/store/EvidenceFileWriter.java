package com.mk.fx.qa.evidence.store;

import com.google.common.io.ByteStreams;
import com.mk.fx.qa.evidence.model.EvidenceItem;
import com.mk.fx.qa.evidence.model.EvidencePayload;
import com.mk.fx.qa.evidence.model.StepStatus;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import lombok.extern.slf4j.Slf4j;

/**
 * Persists collector payloads below the evidence root and turns them into {@link EvidenceItem}s.
 *
 * <p>Layout: {@code <root>/<typeDir>/<executionId>/<itemId>_<epochMillis><ext>}, with a
 * {@code .gz} suffix for compressed types. Item paths are relative to the root and always use
 * {@code /}.
 */
@Slf4j
final class EvidenceFileWriter {

  static final String GZIP_SUFFIX = ".gz";

  private final Path root;
  private final boolean compress;

  EvidenceFileWriter(Path root, boolean compress) {
    this.root = root;
    this.compress = compress;
  }

  /**
   * Writes {@code payload} and describes it. A failed write is logged and yields an item without a
   * path and with size 0.
   *
   * @param stepStatus status of the step the payload was collected for, null for scenario evidence
   */
  EvidenceItem persist(
      String executionId,
      String itemId,
      String scenarioId,
      String stepId,
      StepStatus stepStatus,
      EvidencePayload payload) {
    Instant timestamp = Instant.now();
    var type = payload.type();
    boolean compressed = compress && type.compressible();
    String extension = payload.extension() != null ? payload.extension() : type.extension();
    String fileName =
        itemId + "_" + timestamp.toEpochMilli() + extension + (compressed ? GZIP_SUFFIX : "");
    String relativePath = type.directory() + "/" + executionId + "/" + fileName;

    String storedPath = null;
    long size = 0;
    if (payload.hasContent()) {
      try {
        Path target = resolve(relativePath);
        Files.createDirectories(target.getParent());
        byte[] bytes = compressed ? gzip(payload.content()) : payload.content();
        Files.write(target, bytes);
        storedPath = relativePath;
        size = bytes.length;
      } catch (IOException | UncheckedIOException e) {
        log.error("Failed to store evidence item {} for execution {}", itemId, executionId, e);
      }
    }

    Map<String, Object> metadata = new LinkedHashMap<>(payload.metadata());
    metadata.put("compressed", compressed);
    metadata.put("format", payload.format() != null ? payload.format() : type.format());
    if (stepStatus != null) {
      metadata.put("stepStatus", stepStatus.key());
    }

    return new EvidenceItem(
        itemId,
        type,
        scenarioId,
        stepId,
        payload.name() != null ? payload.name() : type.key() + "_" + timestamp.toEpochMilli(),
        payload.description() != null ? payload.description() : type.key() + " evidence",
        timestamp,
        storedPath,
        size,
        metadata,
        payload.tags());
  }

  /** Reads the stored bytes of {@code item}, gunzipped when the item was compressed. */
  byte[] read(EvidenceItem item) throws IOException {
    if (!item.persisted()) {
      throw new IOException("Evidence item " + item.id() + " has no stored content");
    }
    byte[] raw = Files.readAllBytes(resolve(item.path()));
    return item.compressed() ? gunzip(raw) : raw;
  }

  /** Deletes the file behind {@code item}, also trying the {@code .gz} variant. */
  boolean delete(EvidenceItem item) {
    if (!item.persisted()) {
      return false;
    }
    Path file = resolve(item.path());
    try {
      boolean deleted = Files.deleteIfExists(file);
      if (!item.path().endsWith(GZIP_SUFFIX)) {
        deleted |= Files.deleteIfExists(file.resolveSibling(file.getFileName() + GZIP_SUFFIX));
      }
      return deleted;
    } catch (IOException e) {
      log.warn("Failed to delete evidence file {}: {}", file, e.getMessage());
      return false;
    }
  }

  Path resolve(String relativePath) {
    return root.resolve(relativePath).normalize();
  }

  static byte[] gzip(byte[] content) {
    var out = new ByteArrayOutputStream(Math.max(32, content.length / 2));
    try (var gz = new GZIPOutputStream(out)) {
      gz.write(content);
    } catch (IOException e) {
      throw new UncheckedIOException("gzip failed", e);
    }
    return out.toByteArray();
  }

  static byte[] gunzip(byte[] compressed) throws IOException {
    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      return ByteStreams.toByteArray(in);
    }
  }
}
