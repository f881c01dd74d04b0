package com.flamingo.ai.coursepipeline.service.extraction;

import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.exception.EmptyExtractionException;
import com.flamingo.ai.coursepipeline.exception.MaterialProcessingException;
import com.flamingo.ai.coursepipeline.exception.UnsupportedFormatException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Converts an uploaded file into normalized plain text plus a page breakdown.
 *
 * <p>Routes the declared MIME type to the first {@link DocumentTextExtractor} that supports it
 * (extractors are injected in {@code @Order} order), normalizes line endings and blank-line runs,
 * and rejects results shorter than the configured minimum with {@link EmptyExtractionException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionService {

  private final List<DocumentTextExtractor> extractors;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "extraction.duration", description = "Time to extract text from an upload")
  public ExtractionResult extract(UUID materialId, Path file, String mimeType) {
    DocumentTextExtractor extractor =
        extractors.stream()
            .filter(e -> e.supports(mimeType))
            .findFirst()
            .orElseThrow(
                () -> {
                  meterRegistry.counter("extraction.failure", "reason", "unsupported").increment();
                  return new UnsupportedFormatException(
                      materialId, mimeType, "Unsupported mime type: " + mimeType);
                });

    if (!Files.isReadable(file)) {
      meterRegistry.counter("extraction.failure", "reason", "missing_file").increment();
      throw new MaterialProcessingException(
          materialId,
          "Uploaded file not found: " + file,
          "The uploaded file is no longer available.");
    }

    ExtractionResult raw;
    try {
      raw = extractor.extract(materialId, file, mimeType);
    } catch (RuntimeException e) {
      meterRegistry.counter("extraction.failure", "reason", "parse").increment();
      throw e;
    }

    String text = normalize(raw.fullText());
    int minLength = pipelineConfig.getExtraction().getMinTextLength();
    if (text.length() < minLength) {
      meterRegistry.counter("extraction.failure", "reason", "empty").increment();
      throw new EmptyExtractionException(materialId, text.length(), minLength);
    }

    meterRegistry.counter("extraction.success").increment();
    log.info(
        "Extracted {} pages, {} chars from material {} ({})",
        raw.pageCount(),
        text.length(),
        materialId,
        mimeType);
    return raw.withFullText(text);
  }

  /** Whether an extractor is registered for the MIME type. */
  public boolean supports(String mimeType) {
    return extractors.stream().anyMatch(e -> e.supports(mimeType));
  }

  /** Unifies line endings, collapses three or more newlines into a paragraph break and trims. */
  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    return text.replace("\r\n", "\n").replaceAll("\\n{3,}", "\n\n").trim();
  }
}
