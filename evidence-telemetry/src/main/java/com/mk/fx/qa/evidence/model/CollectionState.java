package com.mk.fx.qa.evidence.model;

/** Lifecycle of one execution's evidence collection. */
public enum CollectionState {
  UNINITIALIZED,
  COLLECTING,
  FINALIZING,
  COMPLETED
}
