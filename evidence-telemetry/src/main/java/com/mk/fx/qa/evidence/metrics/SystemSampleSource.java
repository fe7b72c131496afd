package com.mk.fx.qa.evidence.metrics;

import java.util.List;

/**
 * Probe for OS and process counters. Each reading is requested separately so one failing
 * sub-reading does not cost the others.
 */
public interface SystemSampleSource {

  SystemSample.CpuReading readCpu() throws Exception;

  SystemSample.MemoryReading readMemory() throws Exception;

  SystemSample.DiskReading readDisk() throws Exception;

  /** Collector activity since the previous call. */
  default List<GcEvent> readGcActivity() {
    return List.of();
  }
}
