package com.flamingo.ai.coursepipeline.exception;

import java.time.Duration;

/** Exception raised when a generative-model call exceeds its time budget. */
public class GenerationTimeoutException extends RuntimeException {

  private final Duration timeout;

  public GenerationTimeoutException(Duration timeout, Throwable cause) {
    super("Generation did not finish within " + timeout.toMillis() + " ms", cause);
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
