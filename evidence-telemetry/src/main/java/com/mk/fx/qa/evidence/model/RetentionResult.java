package com.mk.fx.qa.evidence.model;

import java.time.Instant;

/** Outcome of one retention cleanup pass. */
public record RetentionResult(Instant cutoff, int manifestsRemoved, int filesRemoved, int archivesRemoved) {}
