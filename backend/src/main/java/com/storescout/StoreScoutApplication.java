package com.storescout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StoreScoutApplication {

  public static void main(String[] args) {
    SpringApplication.run(StoreScoutApplication.class, args);
  }
}
