package com.flamingo.ai.coursepipeline.exception;

import java.util.UUID;

/** Exception thrown when a file yields too little text to be useful. */
public class EmptyExtractionException extends MaterialProcessingException {

  private final int extractedLength;

  public EmptyExtractionException(UUID materialId, int extractedLength, int minimumLength) {
    super(
        materialId,
        String.format(
            "Could not extract meaningful text from document: %d characters (minimum %d)",
            extractedLength, minimumLength),
        "No readable text was found in this file.");
    this.extractedLength = extractedLength;
  }

  public int getExtractedLength() {
    return extractedLength;
  }
}
