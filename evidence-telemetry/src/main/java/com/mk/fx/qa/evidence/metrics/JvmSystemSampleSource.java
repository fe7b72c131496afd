package com.mk.fx.qa.evidence.metrics;

import java.io.IOException;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SystemSampleSource} backed by the platform MX beans and the default file system.
 */
@Slf4j
public class JvmSystemSampleSource implements SystemSampleSource {

  private static final Set<String> VIRTUAL_STORES =
      Set.of("tmpfs", "devtmpfs", "proc", "sysfs", "overlay", "squashfs", "cgroup", "cgroup2");

  private final Duration cpuWindow;
  private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
  private final Map<String, long[]> lastGc = new ConcurrentHashMap<>();

  public JvmSystemSampleSource() {
    this(Duration.ofMillis(100));
  }

  public JvmSystemSampleSource(Duration cpuWindow) {
    this.cpuWindow = cpuWindow;
  }

  @Override
  public SystemSample.CpuReading readCpu() throws InterruptedException {
    if (!(os instanceof com.sun.management.OperatingSystemMXBean sunOs)) {
      return new SystemSample.CpuReading(0, os.getAvailableProcessors(), os.getSystemLoadAverage());
    }
    long cpuStart = sunOs.getProcessCpuTime();
    long wallStart = System.nanoTime();
    Thread.sleep(cpuWindow.toMillis());
    long cpuDelta = sunOs.getProcessCpuTime() - cpuStart;
    long wallDelta = Math.max(1, System.nanoTime() - wallStart);
    double usage = cpuStart < 0 ? 0 : (double) cpuDelta / wallDelta * 100.0;
    return new SystemSample.CpuReading(
        Math.max(0, usage), os.getAvailableProcessors(), os.getSystemLoadAverage());
  }

  @Override
  public SystemSample.MemoryReading readMemory() {
    MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
    long total = 0;
    long free = 0;
    if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
      total = sunOs.getTotalMemorySize();
      free = sunOs.getFreeMemorySize();
    }
    long used = Math.max(0, total - free);
    double percent = total > 0 ? (double) used / total * 100.0 : 0;
    long committed = heap.getCommitted();
    double heapPercent = committed > 0 ? (double) heap.getUsed() / committed * 100.0 : 0;
    return new SystemSample.MemoryReading(
        total, free, used, percent, heap.getUsed(), committed, heap.getMax(), heapPercent);
  }

  @Override
  public SystemSample.DiskReading readDisk() {
    List<SystemSample.DiskVolume> volumes = new ArrayList<>();
    long totalSize = 0;
    long totalUsed = 0;
    for (FileStore store : FileSystems.getDefault().getFileStores()) {
      if (VIRTUAL_STORES.contains(store.type())) {
        continue;
      }
      try {
        long size = store.getTotalSpace();
        if (size <= 0) {
          continue;
        }
        long available = store.getUsableSpace();
        long used = size - store.getUnallocatedSpace();
        volumes.add(
            new SystemSample.DiskVolume(
                store.name(), store.type(), size, used, available, (double) used / size * 100.0));
        totalSize += size;
        totalUsed += used;
      } catch (IOException e) {
        log.debug("Skipping file store {}: {}", store.name(), e.getMessage());
      }
    }
    double usage = totalSize > 0 ? (double) totalUsed / totalSize * 100.0 : 0;
    return new SystemSample.DiskReading(totalSize, totalUsed, totalSize - totalUsed, usage, volumes);
  }

  @Override
  public List<GcEvent> readGcActivity() {
    var now = Instant.now();
    List<GcEvent> events = new ArrayList<>();
    for (GarbageCollectorMXBean gc : ManagementFactory.getGarbageCollectorMXBeans()) {
      long count = Math.max(0, gc.getCollectionCount());
      long time = Math.max(0, gc.getCollectionTime());
      long[] previous = lastGc.put(gc.getName(), new long[] {count, time});
      if (previous == null) {
        continue;
      }
      long deltaCount = count - previous[0];
      if (deltaCount > 0) {
        events.add(new GcEvent(now, gc.getName(), deltaCount, time - previous[1]));
      }
    }
    return events;
  }
}
