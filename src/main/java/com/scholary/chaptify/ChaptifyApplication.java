package com.scholary.chaptify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChaptifyApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(ChaptifyApplication.class, args)));
  }
}
