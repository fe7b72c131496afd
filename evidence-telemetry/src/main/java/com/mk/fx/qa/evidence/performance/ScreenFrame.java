package com.mk.fx.qa.evidence.performance;

/**
 * One screenshot of a page load.
 *
 * @param timestamp milliseconds relative to the navigation start
 * @param image encoded image bytes (png or jpeg)
 */
public record ScreenFrame(double timestamp, byte[] image) {}
