package com.mk.fx.qa.evidence.performance;

import java.time.Instant;

/**
 * Core Web Vitals of one capture plus the values derived from navigation and long tasks.
 *
 * @param tti time to interactive, not supported without a navigation entry
 * @param tbt total blocking time between FCP and TTI
 * @param speedIndex visual progress integral, see {@link SpeedIndexCalculator}
 */
public record CoreWebVitals(
    Instant timestamp,
    String url,
    VitalReading fcp,
    VitalReading lcp,
    VitalReading fid,
    VitalReading cls,
    VitalReading ttfb,
    VitalReading inp,
    VitalReading tti,
    VitalReading tbt,
    VitalReading speedIndex) {}
