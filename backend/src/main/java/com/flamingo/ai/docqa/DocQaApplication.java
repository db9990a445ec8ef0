package com.flamingo.ai.docqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the single-document question answering backend. */
@SpringBootApplication
public class DocQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocQaApplication.class, args);
  }
}
