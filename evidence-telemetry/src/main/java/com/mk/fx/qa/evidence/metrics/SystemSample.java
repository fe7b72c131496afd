package com.mk.fx.qa.evidence.metrics;

import java.time.Instant;
import java.util.List;

/** One system sampling tick. Readings that could not be gathered are zeroed, never null. */
public record SystemSample(
    Instant timestamp, CpuReading cpu, MemoryReading memory, DiskReading disk) {

  /**
   * @param usage process CPU time over wall-clock time in the measurement window, percent
   * @param loadAverage one-minute system load average, negative when the platform has none
   */
  public record CpuReading(double usage, int cores, double loadAverage) {
    public static final CpuReading ZERO = new CpuReading(0, 0, -1);
  }

  /**
   * @param percent OS physical memory in use, percent
   * @param heapPercent JVM heap used over committed heap, percent
   */
  public record MemoryReading(
      long total,
      long free,
      long used,
      double percent,
      long heapUsed,
      long heapCommitted,
      long heapMax,
      double heapPercent) {
    public static final MemoryReading ZERO = new MemoryReading(0, 0, 0, 0, 0, 0, 0, 0);
  }

  /** @param usage aggregate used space over total space across volumes, percent */
  public record DiskReading(
      long totalSize, long totalUsed, long totalAvailable, double usage, List<DiskVolume> volumes) {
    public static final DiskReading ZERO = new DiskReading(0, 0, 0, 0, List.of());

    public DiskReading {
      volumes = volumes == null ? List.of() : List.copyOf(volumes);
    }
  }

  public record DiskVolume(String name, String type, long size, long used, long available, double usePercent) {}
}
