package com.flamingo.ai.houseanalysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the lease document analysis service. */
@SpringBootApplication
public class HouseAnalysisApplication {

  public static void main(String[] args) {
    SpringApplication.run(HouseAnalysisApplication.class, args);
  }
}
