package com.flamingo.ai.mano;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the Mano context and memory engine. */
@SpringBootApplication
public class ManoContextEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ManoContextEngineApplication.class, args);
  }
}
