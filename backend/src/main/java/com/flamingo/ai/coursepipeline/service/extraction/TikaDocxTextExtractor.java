package com.flamingo.ai.coursepipeline.service.extraction;

import com.flamingo.ai.coursepipeline.exception.UnsupportedFormatException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentTextExtractor} for Office Open XML word-processing files (.docx).
 *
 * <p>DOCX has no physical pages; the text is split into sections on runs of three or more
 * newlines and each section is reported as one page.
 */
@Component
@Order(2)
@Slf4j
public class TikaDocxTextExtractor implements DocumentTextExtractor {

  static final String DOCX_MIME_TYPE =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

  private static final Pattern SECTION_BREAK = Pattern.compile("\\n{3,}");

  @Override
  public ExtractionResult extract(UUID materialId, Path file, String mimeType) {
    String text;
    try {
      text = TikaText.parse(file, mimeType);
    } catch (Exception e) {
      log.error("Tika DOCX extraction failed for material {}: {}", materialId, e.getMessage());
      throw new UnsupportedFormatException(
          materialId, mimeType, "File is corrupted or not a readable DOCX: " + e.getMessage(), e);
    }

    List<ExtractedPage> pages = new ArrayList<>();
    for (String section : SECTION_BREAK.split(text.replace("\r\n", "\n"))) {
      String trimmed = section.trim();
      if (!trimmed.isEmpty()) {
        pages.add(new ExtractedPage(pages.size() + 1, trimmed));
      }
    }
    if (pages.isEmpty()) {
      pages.add(new ExtractedPage(1, text.trim()));
    }

    log.debug(
        "Extracted {} chars in {} sections from DOCX for material {}",
        text.length(),
        pages.size(),
        materialId);
    return new ExtractionResult(text, pages, pages.size());
  }

  @Override
  public boolean supports(String mimeType) {
    return DOCX_MIME_TYPE.equalsIgnoreCase(mimeType);
  }

  /** Shared Tika plumbing for the word-processing extractors. */
  static final class TikaText {

    private TikaText() {}

    static String parse(Path file, String mimeType) throws Exception {
      AutoDetectParser parser = new AutoDetectParser();
      BodyContentHandler handler = new BodyContentHandler(-1);
      Metadata metadata = new Metadata();
      metadata.set(Metadata.CONTENT_TYPE, mimeType);
      try (InputStream in = Files.newInputStream(file)) {
        parser.parse(in, handler, metadata, new ParseContext());
      }
      return handler.toString();
    }
  }
}
