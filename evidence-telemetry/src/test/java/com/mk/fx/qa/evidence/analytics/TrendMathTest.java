package com.mk.fx.qa.evidence.analytics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TrendMathTest {

  @Test
  void changePercent_comparesHalfMeans() {
    double[] values = {10, 10, 10, 50, 50, 50};
    assertEquals(400.0, TrendMath.changePercent(values), 1e-9);
    assertEquals(TrendDirection.UP, TrendMath.direction(values));
  }

  @Test
  void direction_isStable_insideFivePercentBand() {
    double[] values = {50, 51, 49, 50, 50, 49};
    assertTrue(Math.abs(TrendMath.changePercent(values)) < TrendMath.STABLE_BAND_PERCENT);
    assertEquals(TrendDirection.STABLE, TrendMath.direction(values));
  }

  @Test
  void direction_isDown_whenSecondHalfDrops() {
    assertEquals(TrendDirection.DOWN, TrendMath.direction(new double[] {100, 100, 80, 80}));
  }

  @Test
  void changePercent_oddLength_splitsAtFloorHalf() {
    // first half [10], second half [20, 30]
    assertEquals(150.0, TrendMath.changePercent(new double[] {10, 20, 30}), 1e-9);
  }

  @Test
  void changePercent_zeroBaseline_reportsFullSwing() {
    assertEquals(100.0, TrendMath.changePercent(new double[] {0, 0, 5, 5}));
    assertEquals(0.0, TrendMath.changePercent(new double[] {0, 0, 0, 0}));
  }

  @Test
  void forecast_extrapolatesLinearSeries() {
    assertEquals(5.0, TrendMath.forecast(new double[] {1, 2, 3, 4}), 1e-9);
    assertEquals(7.0, TrendMath.forecast(new double[] {7}));
    assertEquals(0.0, TrendMath.forecast(new double[0]));
  }

  @Test
  void trend_requiresThreeSamples() {
    assertTrue(TrendMath.trend("cpu", new double[] {1, 2}).isEmpty());
    MetricTrend trend = TrendMath.trend("cpu", new double[] {1, 2, 3, 4}).orElseThrow();
    assertEquals("cpu", trend.metric());
    assertEquals(TrendDirection.UP, trend.direction());
  }

  @Test
  void pearson_detectsPerfectAndNoCorrelation() {
    assertEquals(1.0, TrendMath.pearson(new double[] {1, 2, 3}, new double[] {2, 4, 6}), 1e-9);
    assertEquals(-1.0, TrendMath.pearson(new double[] {1, 2, 3}, new double[] {6, 4, 2}), 1e-9);
    assertEquals(0.0, TrendMath.pearson(new double[] {1, 1, 1}, new double[] {1, 2, 3}));
    assertEquals(0.0, TrendMath.pearson(new double[] {1, 2}, new double[] {1, 2, 3}));
  }

  @Test
  void spikeIndexes_flagsJumpsAboveThreshold() {
    assertEquals(
        List.of(2, 4), TrendMath.spikeIndexes(new double[] {10, 15, 60, 55, 100}, 30));
  }
}
