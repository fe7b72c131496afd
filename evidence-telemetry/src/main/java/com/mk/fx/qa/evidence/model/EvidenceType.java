package com.mk.fx.qa.evidence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kinds of evidence, with their storage directory, default extension and format. */
public enum EvidenceType {
  SCREENSHOT("screenshots", ".png", "png", false),
  VIDEO("videos", ".webm", "webm", false),
  LOG("logs", ".log", "text", true),
  METRICS("metrics", ".json", "json", true),
  PERFORMANCE("performance", ".json", "json", true),
  NETWORK("logs", ".har", "har", true),
  TRACE("traces", ".zip", "zip", false);

  private final String directory;
  private final String extension;
  private final String format;
  private final boolean compressible;

  EvidenceType(String directory, String extension, String format, boolean compressible) {
    this.directory = directory;
    this.extension = extension;
    this.format = format;
    this.compressible = compressible;
  }

  public String directory() {
    return directory;
  }

  public String extension() {
    return extension;
  }

  public String format() {
    return format;
  }

  public boolean compressible() {
    return compressible;
  }

  @JsonValue
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static EvidenceType fromKey(String key) {
    return valueOf(key.trim().toUpperCase(Locale.ROOT));
  }
}
