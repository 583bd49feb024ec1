package com.flamingo.ai.latexexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the LaTeX export back end. */
@SpringBootApplication
public class LatexExportApplication {

  public static void main(String[] args) {
    SpringApplication.run(LatexExportApplication.class, args);
  }
}
