package com.mk.fx.qa.evidence.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "evidence.metrics")
public class MetricsCfg {

  @DurationUnit(ChronoUnit.MILLIS)
  private Duration interval = Duration.ofMillis(5000);

  private boolean collectSystemMetrics = true;

  private boolean aggregate = true;

  private boolean includeGcMetrics = true;

  private boolean detectMemoryLeaks = true;

  private boolean alerting = true;

  /** One of json, grafana, prometheus. */
  private String exportFormat = "json";

  @Positive private int seriesCapacity = 1000;

  @Valid private Thresholds thresholds = new Thresholds();

  @Data
  public static class Thresholds {
    @Positive private double cpu = 80;
    @Positive private double memory = 85;
    @Positive private double disk = 90;
    @Positive private long responseTimeMs = 5000;
    @Positive private double errorRate = 5;
  }
}
