package com.mk.fx.qa.evidence.analytics;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Trend, forecast, spike and correlation math shared by the metrics and performance engines.
 */
public final class TrendMath {

  /** Changes smaller than this (in percent, either direction) count as stable. */
  public static final double STABLE_BAND_PERCENT = 5.0;

  /** Minimum series length before a trend is reported. */
  public static final int MIN_TREND_SAMPLES = 3;

  private TrendMath() {
    // Utility class, no instantiation
  }

  /**
   * Percentage change of the mean of the second half relative to the first half, splitting at
   * {@code floor(n / 2)}.
   */
  public static double changePercent(double[] values) {
    if (values.length < 2) return 0;
    int split = values.length / 2;
    double first = mean(values, 0, split);
    double second = mean(values, split, values.length);
    if (first == 0) {
      // no baseline to divide by; report full swing in the observed direction
      return second == 0 ? 0 : Math.signum(second) * 100.0;
    }
    return (second - first) / Math.abs(first) * 100.0;
  }

  public static TrendDirection direction(double[] values) {
    if (values.length < 2) return TrendDirection.STABLE;
    double change = changePercent(values);
    if (Math.abs(change) < STABLE_BAND_PERCENT) return TrendDirection.STABLE;
    return change > 0 ? TrendDirection.UP : TrendDirection.DOWN;
  }

  /**
   * Ordinary least squares over (index, value), evaluated one step past the last index.
   */
  public static double forecast(double[] values) {
    int n = values.length;
    if (n == 0) return 0;
    if (n == 1) return values[0];
    double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
    for (int i = 0; i < n; i++) {
      sumX += i;
      sumY += values[i];
      sumXY += i * values[i];
      sumX2 += (double) i * i;
    }
    double slope = (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
    double intercept = (sumY - slope * sumX) / n;
    return slope * n + intercept;
  }

  /** Trend for series longer than two samples, empty otherwise. */
  public static Optional<MetricTrend> trend(String metric, double[] values) {
    if (values.length < MIN_TREND_SAMPLES) return Optional.empty();
    return Optional.of(
        new MetricTrend(metric, direction(values), changePercent(values), forecast(values)));
  }

  /**
   * Pearson correlation coefficient; 0 for unequal lengths, empty input or zero variance.
   */
  public static double pearson(double[] x, double[] y) {
    if (x.length != y.length || x.length == 0) return 0;
    int n = x.length;
    double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0, sumY2 = 0;
    for (int i = 0; i < n; i++) {
      sumX += x[i];
      sumY += y[i];
      sumXY += x[i] * y[i];
      sumX2 += x[i] * x[i];
      sumY2 += y[i] * y[i];
    }
    double numerator = n * sumXY - sumX * sumY;
    double denominator = Math.sqrt((n * sumX2 - sumX * sumX) * (n * sumY2 - sumY * sumY));
    if (denominator == 0 || !Double.isFinite(denominator)) return 0;
    return numerator / denominator;
  }

  /** Indexes {@code i > 0} where {@code values[i] - values[i-1] > threshold}. */
  public static List<Integer> spikeIndexes(double[] values, double threshold) {
    List<Integer> out = new ArrayList<>();
    for (int i = 1; i < values.length; i++) {
      if (values[i] - values[i - 1] > threshold) {
        out.add(i);
      }
    }
    return out;
  }

  private static double mean(double[] values, int from, int to) {
    double sum = 0;
    for (int i = from; i < to; i++) sum += values[i];
    return sum / (to - from);
  }
}
