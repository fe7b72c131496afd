package com.mk.fx.qa.evidence.analytics;

import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe running min, max, sum and mean of one metric.
 */
public final class RunningAggregate {

  private final DoubleAccumulator min = new DoubleAccumulator(Math::min, Double.POSITIVE_INFINITY);
  private final DoubleAccumulator max = new DoubleAccumulator(Math::max, Double.NEGATIVE_INFINITY);
  private final DoubleAdder sum = new DoubleAdder();
  private final LongAdder count = new LongAdder();

  public void record(double value) {
    if (!Double.isFinite(value)) return;
    min.accumulate(value);
    max.accumulate(value);
    sum.add(value);
    count.increment();
  }

  public long count() {
    return count.sum();
  }

  public double min() {
    return count() == 0 ? 0 : min.get();
  }

  public double max() {
    return count() == 0 ? 0 : max.get();
  }

  public double sum() {
    return sum.sum();
  }

  public double avg() {
    long c = count();
    return c == 0 ? 0 : sum() / c;
  }

  public Snapshot snapshot() {
    return new Snapshot(min(), max(), avg(), sum(), count());
  }

  public record Snapshot(double min, double max, double avg, double sum, long count) {}
}
