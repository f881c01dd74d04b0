package com.flamingo.ai.coursepipeline.exception;

/** Exception thrown when the vector store rejects a write or delete. Retryable. */
public class VectorStoreWriteException extends RuntimeException {

  private final String userMessage;

  public VectorStoreWriteException(String message) {
    super(message);
    this.userMessage = "Search index is temporarily unavailable. Please try again.";
  }

  public VectorStoreWriteException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search index is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
