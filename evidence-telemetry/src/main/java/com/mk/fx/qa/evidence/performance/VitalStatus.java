package com.mk.fx.qa.evidence.performance;

public enum VitalStatus {
  /** The browser reported a value. */
  AVAILABLE,
  /** The browser supports the metric but did not report it before the deadline. */
  TIMED_OUT,
  /** The browser does not expose the metric. */
  NOT_SUPPORTED
}
