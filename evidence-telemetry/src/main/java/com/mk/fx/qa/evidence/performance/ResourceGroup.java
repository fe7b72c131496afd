package com.mk.fx.qa.evidence.performance;

/**
 * Totals of the resources of one initiator type.
 *
 * @param size transferred bytes
 * @param duration summed load durations
 */
public record ResourceGroup(int count, long size, double duration, int cached) {

  public static final ResourceGroup EMPTY = new ResourceGroup(0, 0, 0, 0);

  public ResourceGroup plus(ResourceTiming r) {
    return new ResourceGroup(
        count + 1, size + r.transferSize(), duration + r.duration(), cached + (r.cached() ? 1 : 0));
  }
}
