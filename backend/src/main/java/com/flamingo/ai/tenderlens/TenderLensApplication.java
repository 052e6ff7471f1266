package com.flamingo.ai.tenderlens;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the tender document digest service. */
@SpringBootApplication
public class TenderLensApplication {

  public static void main(String[] args) {
    SpringApplication.run(TenderLensApplication.class, args);
  }
}
