package com.flamingo.ai.coursepipeline.service.extraction;

import com.flamingo.ai.coursepipeline.exception.UnsupportedFormatException;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Best-effort {@link DocumentTextExtractor} for legacy binary Word files (.doc).
 *
 * <p>Any parse failure, and a parse that yields no text, is reported as {@link
 * UnsupportedFormatException} so the user is asked to convert the file instead of getting an empty
 * material.
 */
@Component
@Order(3)
@Slf4j
public class LegacyDocTextExtractor implements DocumentTextExtractor {

  static final String DOC_MIME_TYPE = "application/msword";

  private static final String CONVERT_HINT =
      "Legacy .doc format not fully supported. Please convert to .docx";

  @Override
  public ExtractionResult extract(UUID materialId, Path file, String mimeType) {
    String text;
    try {
      text = TikaDocxTextExtractor.TikaText.parse(file, mimeType);
    } catch (Exception e) {
      log.warn("Legacy .doc extraction failed for material {}: {}", materialId, e.getMessage());
      throw new UnsupportedFormatException(materialId, mimeType, CONVERT_HINT, e);
    }

    if (text.isBlank()) {
      log.warn("Legacy .doc extraction for material {} produced no text", materialId);
      throw new UnsupportedFormatException(materialId, mimeType, CONVERT_HINT);
    }
    return new ExtractionResult(text, List.of(new ExtractedPage(1, text.trim())), 1);
  }

  @Override
  public boolean supports(String mimeType) {
    return DOC_MIME_TYPE.equalsIgnoreCase(mimeType);
  }
}
