package com.mk.fx.qa.evidence.metrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flags steady heap growth. Keeps the last {@value #WINDOW} heap readings per context; a window of
 * at least {@value #MIN_READINGS} strictly increasing readings that grew by more than
 * {@value #GROWTH_PERCENT} percent is reported.
 */
final class LeakDetector {

  static final int WINDOW = 10;
  static final int MIN_READINGS = 5;
  static final double GROWTH_PERCENT = 50.0;

  private final Map<String, Deque<Long>> history = new ConcurrentHashMap<>();

  /** Records {@code heapUsed} and returns the growth percent when the window looks like a leak. */
  OptionalDouble record(String contextId, long heapUsed) {
    Deque<Long> window = history.computeIfAbsent(contextId, k -> new ArrayDeque<>());
    synchronized (window) {
      window.addLast(heapUsed);
      while (window.size() > WINDOW) {
        window.removeFirst();
      }
      if (window.size() < MIN_READINGS) {
        return OptionalDouble.empty();
      }
      long previous = -1;
      for (long reading : window) {
        if (previous >= 0 && reading <= previous) {
          return OptionalDouble.empty();
        }
        previous = reading;
      }
      long first = window.peekFirst();
      if (first <= 0) {
        return OptionalDouble.empty();
      }
      double growth = (double) (window.peekLast() - first) / first * 100.0;
      return growth > GROWTH_PERCENT ? OptionalDouble.of(growth) : OptionalDouble.empty();
    }
  }

  /** Oldest reading currently in the window, used as the alert baseline. */
  long baseline(String contextId) {
    Deque<Long> window = history.get(contextId);
    if (window == null) return 0;
    synchronized (window) {
      return window.isEmpty() ? 0 : window.peekFirst();
    }
  }

  void clear() {
    history.clear();
  }
}
