package com.mk.fx.qa.evidence.analytics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class StatisticsTest {

  @Test
  void summarise_usesFloorIndexRule() {
    double[] values = IntStream.rangeClosed(1, 100).asDoubleStream().toArray();
    SeriesStats stats = Statistics.summarise(values);

    assertEquals(1, stats.min());
    assertEquals(100, stats.max());
    assertEquals(50.5, stats.avg(), 1e-9);
    assertEquals(5050, stats.sum(), 1e-9);
    assertEquals(100, stats.count());
    assertEquals(51, stats.p50());
    assertEquals(91, stats.p90());
    assertEquals(96, stats.p95());
    assertEquals(100, stats.p99());
  }

  @Test
  void summarise_keepsOrderingInvariants_onSkewedSeries() {
    SeriesStats stats = Statistics.summarise(List.of(5, 1, 1000, 3, 2, 2, 7));

    assertTrue(stats.min() <= stats.avg() && stats.avg() <= stats.max());
    assertTrue(stats.min() <= stats.p50());
    assertTrue(stats.p50() <= stats.p90());
    assertTrue(stats.p90() <= stats.p95());
    assertTrue(stats.p95() <= stats.p99());
    assertTrue(stats.p99() <= stats.max());
    // heavy tail: the mean sits above the median
    assertTrue(stats.avg() > stats.p50());
  }

  @Test
  void summarise_singleValue_collapsesEverything() {
    SeriesStats stats = Statistics.summarise(new double[] {42});
    assertEquals(42, stats.min());
    assertEquals(42, stats.p99());
    assertEquals(42, stats.avg());
  }

  @Test
  void summarise_empty_returnsZeros() {
    assertSame(SeriesStats.EMPTY, Statistics.summarise(new double[0]));
    assertSame(SeriesStats.EMPTY, Statistics.summarise(List.<Integer>of()));
  }

  @Test
  void nearestRank_matchesCeilRule_andRejectsOutOfRange() {
    double[] sorted = IntStream.rangeClosed(1, 10).asDoubleStream().toArray();
    assertEquals(5, Statistics.nearestRank(sorted, 50));
    assertEquals(10, Statistics.nearestRank(sorted, 95));
    assertEquals(1, Statistics.nearestRank(sorted, 0));
    assertEquals(0, Statistics.nearestRank(new double[0], 50));
    assertThrows(IllegalArgumentException.class, () -> Statistics.nearestRank(sorted, 101));
  }
}
