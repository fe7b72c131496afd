package com.mk.fx.qa.evidence.performance;

/**
 * Main-thread task longer than 50 ms.
 *
 * @param attribution container that ran the task, may be null
 */
public record LongTask(double startTime, double duration, String attribution) {}
