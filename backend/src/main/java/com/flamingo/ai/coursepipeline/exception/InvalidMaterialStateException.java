package com.flamingo.ai.coursepipeline.exception;

import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import java.util.UUID;

/** Exception thrown when a material is not in a status that allows the requested action. */
public class InvalidMaterialStateException extends RuntimeException {

  private final UUID materialId;
  private final MaterialStatus status;
  private final String userMessage;

  public InvalidMaterialStateException(UUID materialId, MaterialStatus status, String userMessage) {
    super("Material " + materialId + " is " + status + ": " + userMessage);
    this.materialId = materialId;
    this.status = status;
    this.userMessage = userMessage;
  }

  public UUID getMaterialId() {
    return materialId;
  }

  public MaterialStatus getStatus() {
    return status;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
