package com.flamingo.ai.casestudy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Document to case study generator. */
@SpringBootApplication
public class CaseStudyApplication {

  public static void main(String[] args) {
    SpringApplication.run(CaseStudyApplication.class, args);
  }
}
