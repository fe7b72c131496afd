package com.mk.fx.qa.evidence.performance;

import java.util.List;

/** User timing marks and measures recorded by the page. */
public record UserTimings(List<Mark> marks, List<Measure> measures) {

  public UserTimings {
    marks = marks == null ? List.of() : List.copyOf(marks);
    measures = measures == null ? List.of() : List.copyOf(measures);
  }

  public record Mark(String name, double startTime) {}

  public record Measure(String name, double startTime, double duration) {}
}
