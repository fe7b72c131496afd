package com.mk.fx.qa.evidence;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EvidenceTelemetryApplication {

  public static void main(String[] args) {
    SpringApplication.run(EvidenceTelemetryApplication.class, args);
  }
}
