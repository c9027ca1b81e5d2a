package com.delta.creatoringest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CreatorIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(CreatorIngestApplication.class, args);
  }
}
