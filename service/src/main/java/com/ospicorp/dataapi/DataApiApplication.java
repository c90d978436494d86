package com.ospicorp.dataapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DataApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(DataApiApplication.class, args);
  }
}
