package com.flamingo.ai.coursepipeline.exception;

import java.util.UUID;

/** Exception thrown when no reliable extractor exists for a file's format. */
public class UnsupportedFormatException extends MaterialProcessingException {

  private final String mimeType;

  public UnsupportedFormatException(UUID materialId, String mimeType, String message) {
    super(materialId, message, "This file format is not supported. Please upload a PDF or DOCX.");
    this.mimeType = mimeType;
  }

  public UnsupportedFormatException(
      UUID materialId, String mimeType, String message, Throwable cause) {
    super(
        materialId,
        message,
        "This file format is not supported. Please upload a PDF or DOCX.",
        cause);
    this.mimeType = mimeType;
  }

  public String getMimeType() {
    return mimeType;
  }
}
