package com.flamingo.ai.coursepipeline.exception;

/** Exception thrown when the embedding backend cannot be reached. Retryable. */
public class EmbeddingServiceUnavailableException extends RuntimeException {

  private final String userMessage;

  public EmbeddingServiceUnavailableException(String message) {
    super(message);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public EmbeddingServiceUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
