package com.mk.fx.qa.evidence.model;

/** Thrown when a lifecycle operation is invoked in a state that does not allow it. */
public class EvidenceStateException extends RuntimeException {

  public EvidenceStateException(String message) {
    super(message);
  }
}
