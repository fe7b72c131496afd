package com.mk.fx.qa.evidence.dto;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;

/**
 * Reporting-friendly summary of one execution's evidence.
 *
 * @param failedStepEvidence items collected for steps that failed
 * @param storage store settings in effect (retention, compression, size limit)
 */
@Builder
public record EvidenceExport(
    String executionId,
    Instant startTime,
    Instant endTime,
    long durationMs,
    int totalItems,
    long totalSize,
    String totalSizeHuman,
    Map<String, Integer> byType,
    int scenarios,
    int failedStepEvidence,
    Map<String, Object> environment,
    Map<String, Object> storage) {}
