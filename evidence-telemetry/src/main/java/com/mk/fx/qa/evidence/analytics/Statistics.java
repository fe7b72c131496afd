package com.mk.fx.qa.evidence.analytics;

import java.util.Arrays;
import java.util.Collection;

/** Percentile and summary helpers over plain numeric series. */
public final class Statistics {

  private Statistics() {
    // Utility class, no instantiation
  }

  /**
   * Summarises {@code values} using the floor index rule {@code sorted[floor(n * q)]}.
   */
  public static SeriesStats summarise(double[] values) {
    if (values == null || values.length == 0) {
      return SeriesStats.EMPTY;
    }
    double[] sorted = Arrays.copyOf(values, values.length);
    Arrays.sort(sorted);
    double sum = 0;
    for (double v : sorted) sum += v;
    int n = sorted.length;
    return new SeriesStats(
        sorted[0],
        sorted[n - 1],
        sum / n,
        sum,
        n,
        floorQuantile(sorted, 0.5),
        floorQuantile(sorted, 0.75),
        floorQuantile(sorted, 0.9),
        floorQuantile(sorted, 0.95),
        floorQuantile(sorted, 0.99));
  }

  public static SeriesStats summarise(Collection<? extends Number> values) {
    return summarise(toArray(values));
  }

  /**
   * Nearest-rank percentile {@code sorted[ceil(n * p / 100) - 1]}, 0 for an empty series.
   *
   * @param sorted values in ascending order
   * @param percentile 0..100
   */
  public static double nearestRank(double[] sorted, double percentile) {
    if (percentile < 0 || percentile > 100)
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    if (sorted.length == 0) return 0;
    int idx = (int) Math.ceil(sorted.length * (percentile / 100.0)) - 1;
    return sorted[Math.min(sorted.length - 1, Math.max(0, idx))];
  }

  public static double average(double[] values) {
    if (values.length == 0) return 0;
    double sum = 0;
    for (double v : values) sum += v;
    return sum / values.length;
  }

  public static double[] toArray(Collection<? extends Number> values) {
    return values.stream().mapToDouble(Number::doubleValue).toArray();
  }

  private static double floorQuantile(double[] sorted, double q) {
    int idx = (int) Math.floor(sorted.length * q);
    return sorted[Math.min(sorted.length - 1, idx)];
  }
}
