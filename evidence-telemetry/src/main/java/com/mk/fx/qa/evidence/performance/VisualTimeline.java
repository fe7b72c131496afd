package com.mk.fx.qa.evidence.performance;

import java.util.List;

/**
 * Visual progression of a page load: the first contentful paint at area 0 followed by the paint
 * area of each image as it finished loading.
 *
 * @param viewportArea visible viewport area in square pixels
 * @param loadTime navigation load end, used to extend a timeline that ends early
 */
public record VisualTimeline(double viewportArea, double loadTime, List<VisualEvent> events) {

  public VisualTimeline {
    events = events == null ? List.of() : List.copyOf(events);
  }

  /** @param area newly painted area at {@code time} */
  public record VisualEvent(double time, double area) {}
}
