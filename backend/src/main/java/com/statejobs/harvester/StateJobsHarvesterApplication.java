package com.statejobs.harvester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StateJobsHarvesterApplication {

  public static void main(String[] args) {
    SpringApplication.run(StateJobsHarvesterApplication.class, args);
  }
}
