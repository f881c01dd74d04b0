package com.flamingo.ai.coursepipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Course material ingestion service: extraction, structuring and embedding of uploads. */
@SpringBootApplication
public class CoursePipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(CoursePipelineApplication.class, args);
  }
}
