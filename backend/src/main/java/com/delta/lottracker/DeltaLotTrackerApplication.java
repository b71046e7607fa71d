package com.delta.lottracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaLotTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaLotTrackerApplication.class, args);
  }
}
