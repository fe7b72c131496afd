package com.mk.fx.qa.evidence.analytics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity, thread-safe ring buffer keeping the most recent samples of one series.
 *
 * @param <T> sample type
 */
public final class SampleRing<T> {

  private final Object[] data;
  private long written;

  public SampleRing(int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("Capacity must be > 0");
    this.data = new Object[capacity];
  }

  public synchronized void add(T sample) {
    data[(int) (written % data.length)] = sample;
    written++;
  }

  public synchronized int size() {
    return (int) Math.min(written, data.length);
  }

  /** Total number of samples ever added, including overwritten ones. */
  public synchronized long written() {
    return written;
  }

  @SuppressWarnings("unchecked")
  public synchronized Optional<T> latest() {
    if (written == 0) return Optional.empty();
    return Optional.of((T) data[(int) ((written - 1) % data.length)]);
  }

  /** Samples oldest first. */
  @SuppressWarnings("unchecked")
  public synchronized List<T> snapshot() {
    int size = size();
    List<T> out = new ArrayList<>(size);
    long first = written - size;
    for (long i = first; i < written; i++) {
      out.add((T) data[(int) (i % data.length)]);
    }
    return out;
  }

  public synchronized void clear() {
    Arrays.fill(data, null);
    written = 0;
  }
}
