package com.mk.fx.qa.evidence.performance;

import java.time.Instant;

/**
 * Reads performance entries from a live browser page. Implementations wrap a browser automation
 * driver and are attached per scenario with {@link PerformanceEngine#attachProbe}.
 */
@FunctionalInterface
public interface BrowserProbe {

  /**
   * Captures the current performance state of the page.
   *
   * <p>Observers for asynchronously reported vitals (LCP, FID, CLS, INP) must stop waiting at
   * {@code deadline} and report {@link VitalReading#timedOut()} for vitals not seen by then, and
   * {@link VitalReading#notSupported()} for vitals the browser does not expose.
   */
  PerformancePayload capture(String scenarioId, Instant deadline);
}
