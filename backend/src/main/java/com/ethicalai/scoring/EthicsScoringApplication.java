package com.ethicalai.scoring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EthicsScoringApplication {

  public static void main(String[] args) {
    SpringApplication.run(EthicsScoringApplication.class, args);
  }
}
