package com.flamingo.ai.corpusprep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CorpusPrepApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(CorpusPrepApplication.class, args)));
  }
}
