package com.flamingo.ai.coursepipeline.service.extraction;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Extracts plain text from an uploaded file of one format family.
 *
 * <p>Implementations read from the file path rather than a fully buffered byte array and must be
 * stateless so a single instance can serve concurrent extraction workers.
 */
public interface DocumentTextExtractor {

  /**
   * Extracts the raw text of the file.
   *
   * @param materialId owning material, used for error reporting
   * @param file path of the stored upload
   * @param mimeType declared MIME type
   * @return raw, not yet normalized, extraction result
   */
  ExtractionResult extract(UUID materialId, Path file, String mimeType);

  /**
   * Returns {@code true} if this extractor handles the given MIME type.
   *
   * @param mimeType declared MIME type
   * @return {@code true} if supported
   */
  boolean supports(String mimeType);
}
