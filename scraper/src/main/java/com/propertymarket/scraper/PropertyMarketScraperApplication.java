package com.propertymarket.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PropertyMarketScraperApplication {

  public static void main(String[] args) {
    SpringApplication.run(PropertyMarketScraperApplication.class, args);
  }
}
