package com.scholary.livefeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LivefeedApplication {

  public static void main(String[] args) {
    SpringApplication.run(LivefeedApplication.class, args);
  }
}
