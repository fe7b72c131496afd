package com.mk.fx.qa.evidence.performance;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class VitalReadingTest {

  @Test
  void of_negativeOrNonFinite_rejected() {
    assertThrows(IllegalArgumentException.class, () -> VitalReading.of(-1));
    assertThrows(IllegalArgumentException.class, () -> VitalReading.of(Double.NaN));
  }

  @Test
  void unavailableReading_cannotCarryValue() {
    assertThrows(
        IllegalArgumentException.class, () -> new VitalReading(VitalStatus.TIMED_OUT, 10.0));
  }

  @Test
  void orElse_usesFallbackWhenUnavailable() {
    assertEquals(5, VitalReading.timedOut().orElse(5), 1e-9);
    assertEquals(12, VitalReading.of(12).orElse(5), 1e-9);
    assertFalse(VitalReading.notSupported().isAvailable());
    assertTrue(VitalReading.notSupported().asOptional().isEmpty());
  }
}
