package com.mk.fx.qa.evidence.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "evidence.store")
public class EvidenceStoreCfg {

  @NotBlank private String path = "./evidence";

  @Positive private long maxSizeMb = 100;

  private boolean compress = true;

  private boolean archive = false;

  private boolean deleteAfterArchive = false;

  @Min(0)
  private int retentionDays = 7;

  @Min(1)
  @Max(64)
  private int concurrency = 4;

  public Path rootPath() {
    return Path.of(path).toAbsolutePath().normalize();
  }

  public long maxSizeBytes() {
    return maxSizeMb * 1024L * 1024L;
  }
}
