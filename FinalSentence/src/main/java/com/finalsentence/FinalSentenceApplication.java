package com.finalsentence;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinalSentenceApplication {

  public static void main(String[] args) {
    SpringApplication.run(FinalSentenceApplication.class, args);
  }
}
