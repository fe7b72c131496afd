package com.mk.fx.qa.evidence.performance;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * Everything a {@link BrowserProbe} observed for one page at one point in a scenario. Absent
 * entries default to empty lists and {@link VitalReading#notSupported()}.
 *
 * @param interactionDurations event durations used to derive INP when {@code inp} is not reported
 */
@Builder
public record PerformancePayload(
    Instant timestamp,
    String url,
    NavigationTiming navigation,
    List<ResourceTiming> resources,
    VitalReading fcp,
    VitalReading lcp,
    VitalReading fid,
    VitalReading cls,
    VitalReading inp,
    List<Double> interactionDurations,
    List<LongTask> longTasks,
    BrowserMemory memory,
    UserTimings userTimings,
    VisualTimeline visualTimeline,
    List<ScreenFrame> frames) {

  public PerformancePayload {
    timestamp = timestamp == null ? Instant.now() : timestamp;
    resources = resources == null ? List.of() : List.copyOf(resources);
    fcp = fcp == null ? VitalReading.notSupported() : fcp;
    lcp = lcp == null ? VitalReading.notSupported() : lcp;
    fid = fid == null ? VitalReading.notSupported() : fid;
    cls = cls == null ? VitalReading.notSupported() : cls;
    inp = inp == null ? VitalReading.notSupported() : inp;
    interactionDurations = interactionDurations == null ? List.of() : List.copyOf(interactionDurations);
    longTasks = longTasks == null ? List.of() : List.copyOf(longTasks);
    frames = frames == null ? List.of() : List.copyOf(frames);
  }

  /** Page URL, preferring the navigation entry. */
  public String pageUrl() {
    return navigation != null && navigation.url() != null ? navigation.url() : url;
  }
}
