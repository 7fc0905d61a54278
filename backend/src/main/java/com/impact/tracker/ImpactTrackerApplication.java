package com.impact.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ImpactTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ImpactTrackerApplication.class, args);
  }
}
