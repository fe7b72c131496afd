package com.mk.fx.qa.evidence.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "evidence.performance")
public class PerformanceCfg {

  private Duration vitalsTimeout = Duration.ofSeconds(10);

  @Positive private int seriesCapacity = 200;

  @Valid private Budget budget = new Budget();

  /** Budget table, milliseconds except for CLS which is unitless. */
  @Data
  public static class Budget {
    @Positive private double fcp = 1800;
    @Positive private double lcp = 2500;
    @Positive private double fid = 100;
    @Positive private double cls = 0.1;
    @Positive private double ttfb = 800;
    @Positive private double tti = 3800;
    @Positive private double tbt = 200;
    @Positive private double inp = 200;
    @Positive private double pageLoad = 3000;
    @Positive private double resourceLoad = 1000;
  }
}
