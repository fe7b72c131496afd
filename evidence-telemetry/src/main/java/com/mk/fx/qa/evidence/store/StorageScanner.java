package com.mk.fx.qa.evidence.store;

import com.mk.fx.qa.evidence.model.EvidenceType;
import com.mk.fx.qa.evidence.model.StorageStats;
import com.mk.fx.qa.evidence.model.StorageStats.DirectoryUsage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/** Walks the evidence root and reports disk usage per type directory. */
@Slf4j
final class StorageScanner {

  private final Path root;

  StorageScanner(Path root) {
    this.root = root;
  }

  StorageStats scan() {
    Set<String> directories = new TreeSet<>();
    for (EvidenceType type : EvidenceType.values()) {
      directories.add(type.directory());
    }

    Map<String, DirectoryUsage> byDirectory = new LinkedHashMap<>();
    long totalFiles = 0;
    long totalBytes = 0;
    for (String directory : directories) {
      DirectoryUsage usage = usage(root.resolve(directory));
      byDirectory.put(directory, usage);
      totalFiles += usage.files();
      totalBytes += usage.bytes();
    }

    DirectoryUsage archives = usage(root.resolve(EvidenceArchiver.DIRECTORY));
    int manifests = countManifests();
    return new StorageStats(
        totalFiles, totalBytes, (int) archives.files(), manifests, byDirectory);
  }

  private DirectoryUsage usage(Path directory) {
    if (!Files.isDirectory(directory)) {
      return new DirectoryUsage(0, 0);
    }
    long[] totals = new long[2];
    try (Stream<Path> walk = Files.walk(directory)) {
      walk.filter(Files::isRegularFile)
          .forEach(
              file -> {
                totals[0]++;
                totals[1] += sizeOf(file);
              });
    } catch (IOException | UncheckedIOException e) {
      log.warn("Failed to scan {}: {}", directory, e.getMessage());
    }
    return new DirectoryUsage(totals[0], totals[1]);
  }

  private int countManifests() {
    if (!Files.isDirectory(root)) {
      return 0;
    }
    try (Stream<Path> list = Files.list(root)) {
      return (int)
          list.map(p -> p.getFileName().toString())
              .filter(n -> n.startsWith(ManifestWriter.PREFIX) && n.endsWith(ManifestWriter.SUFFIX))
              .count();
    } catch (IOException e) {
      log.warn("Failed to list {}: {}", root, e.getMessage());
      return 0;
    }
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      log.warn("Cannot read size of {}: {}", file, e.getMessage());
      return 0;
    }
  }
}
