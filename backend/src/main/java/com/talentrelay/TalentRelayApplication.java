package com.talentrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TalentRelayApplication {

  public static void main(String[] args) {
    SpringApplication.run(TalentRelayApplication.class, args);
  }
}
