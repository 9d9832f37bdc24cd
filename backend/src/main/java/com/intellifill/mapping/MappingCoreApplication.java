package com.intellifill.mapping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MappingCoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(MappingCoreApplication.class, args);
  }
}
