package com.siteready;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SiteReadyApplication {

  public static void main(String[] args) {
    SpringApplication.run(SiteReadyApplication.class, args);
  }
}
