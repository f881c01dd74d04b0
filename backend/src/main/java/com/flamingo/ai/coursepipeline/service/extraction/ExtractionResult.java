package com.flamingo.ai.coursepipeline.service.extraction;

import java.util.List;

/**
 * Result of extracting text from an uploaded file.
 *
 * @param fullText normalized text of the whole file
 * @param pages non-empty page or section breakdown, in document order
 * @param pageCount number of pages reported by the file (may exceed {@code pages.size()} when the
 *     page limit applies)
 */
public record ExtractionResult(String fullText, List<ExtractedPage> pages, int pageCount) {

  public ExtractionResult {
    pages = List.copyOf(pages);
  }

  public ExtractionResult withFullText(String text) {
    return new ExtractionResult(text, pages, pageCount);
  }
}
