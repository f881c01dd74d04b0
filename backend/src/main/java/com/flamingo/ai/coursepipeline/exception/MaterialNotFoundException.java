package com.flamingo.ai.coursepipeline.exception;

import java.util.UUID;

/** Exception thrown when a material is not found. */
public class MaterialNotFoundException extends RuntimeException {

  private final UUID materialId;

  public MaterialNotFoundException(UUID materialId) {
    super("Material not found: " + materialId);
    this.materialId = materialId;
  }

  public UUID getMaterialId() {
    return materialId;
  }
}
