package com.mk.fx.qa.evidence.performance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One Core Web Vital observation. {@code value} is present only when the status is
 * {@link VitalStatus#AVAILABLE}, and is then finite and non-negative.
 */
public record VitalReading(VitalStatus status, Double value) {

  private static final VitalReading TIMED_OUT = new VitalReading(VitalStatus.TIMED_OUT, null);
  private static final VitalReading NOT_SUPPORTED =
      new VitalReading(VitalStatus.NOT_SUPPORTED, null);

  public VitalReading {
    Objects.requireNonNull(status, "status");
    if (status == VitalStatus.AVAILABLE) {
      if (value == null || !Double.isFinite(value) || value < 0) {
        throw new IllegalArgumentException("Available vital needs a finite value >= 0: " + value);
      }
    } else if (value != null) {
      throw new IllegalArgumentException(status + " vital cannot carry a value");
    }
  }

  public static VitalReading of(double value) {
    return new VitalReading(VitalStatus.AVAILABLE, value);
  }

  public static VitalReading timedOut() {
    return TIMED_OUT;
  }

  public static VitalReading notSupported() {
    return NOT_SUPPORTED;
  }

  @JsonIgnore
  public boolean isAvailable() {
    return status == VitalStatus.AVAILABLE;
  }

  public OptionalDouble asOptional() {
    return isAvailable() ? OptionalDouble.of(value) : OptionalDouble.empty();
  }

  public double orElse(double fallback) {
    return isAvailable() ? value : fallback;
  }
}
