package com.mk.fx.qa.evidence.metrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/** Test source returning queued readings; the last value of each queue repeats. */
class ScriptedSampleSource implements SystemSampleSource {

  private final Deque<Double> cpu = new ArrayDeque<>();
  private final Deque<Long> heap = new ArrayDeque<>();
  double memoryPercent = 40;
  double diskUsage = 50;
  boolean failCpu;

  ScriptedSampleSource cpu(double... values) {
    for (double v : values) cpu.addLast(v);
    return this;
  }

  ScriptedSampleSource heap(long... values) {
    for (long v : values) heap.addLast(v);
    return this;
  }

  @Override
  public SystemSample.CpuReading readCpu() {
    if (failCpu) {
      throw new IllegalStateException("cpu counter unavailable");
    }
    return new SystemSample.CpuReading(next(cpu, 10.0), 4, 1.0);
  }

  @Override
  public SystemSample.MemoryReading readMemory() {
    long used = next(heap, 100L);
    return new SystemSample.MemoryReading(
        1000, 600, 400, memoryPercent, used, used * 2, used * 4, 50);
  }

  @Override
  public SystemSample.DiskReading readDisk() {
    return new SystemSample.DiskReading(1000, 500, 500, diskUsage, List.of());
  }

  private static <T> T next(Deque<T> queue, T fallback) {
    if (queue.isEmpty()) {
      return fallback;
    }
    return queue.size() == 1 ? queue.peekFirst() : queue.pollFirst();
  }
}
