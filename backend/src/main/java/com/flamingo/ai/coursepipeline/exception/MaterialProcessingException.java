package com.flamingo.ai.coursepipeline.exception;

import java.util.UUID;

/** Exception thrown when processing a material fails. */
public class MaterialProcessingException extends RuntimeException {

  private final UUID materialId;
  private final String userMessage;

  public MaterialProcessingException(UUID materialId, String message) {
    super(message);
    this.materialId = materialId;
    this.userMessage = "Failed to process material";
  }

  public MaterialProcessingException(UUID materialId, String message, Throwable cause) {
    super(message, cause);
    this.materialId = materialId;
    this.userMessage = "Failed to process material";
  }

  public MaterialProcessingException(UUID materialId, String message, String userMessage) {
    super(message);
    this.materialId = materialId;
    this.userMessage = userMessage;
  }

  public MaterialProcessingException(
      UUID materialId, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.materialId = materialId;
    this.userMessage = userMessage;
  }

  public UUID getMaterialId() {
    return materialId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
