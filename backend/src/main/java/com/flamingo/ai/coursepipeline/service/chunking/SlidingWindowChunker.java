package com.flamingo.ai.coursepipeline.service.chunking;

import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits text into fixed-size overlapping windows.
 *
 * <p>Each window is at most {@code size} characters. When a sentence boundary ({@code ". "}) falls
 * in the second half of a window the window is shortened to end just after it. The next window
 * starts {@code overlap} characters before the previous end. Whitespace-only windows are dropped
 * and do not consume an index.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlidingWindowChunker {

  private static final String SENTENCE_BREAK = ". ";

  private final PipelineConfig pipelineConfig;

  public List<TextChunk> chunk(String text) {
    PipelineConfig.Chunking config = pipelineConfig.getChunking();
    List<TextChunk> chunks = chunk(text, config.getSize(), config.getOverlap());
    log.debug(
        "Chunked {} chars into {} chunks (size={}, overlap={})",
        text == null ? 0 : text.length(),
        chunks.size(),
        config.getSize(),
        config.getOverlap());
    return chunks;
  }

  static List<TextChunk> chunk(String text, int size, int overlap) {
    if (size <= 0 || overlap < 0 || overlap >= size) {
      throw new IllegalArgumentException(
          "Invalid chunking settings: size=" + size + ", overlap=" + overlap);
    }
    List<TextChunk> chunks = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return chunks;
    }

    int length = text.length();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + size, length);

      if (end < length) {
        int lastBreak = text.lastIndexOf(SENTENCE_BREAK, end);
        if (lastBreak > start + size / 2) {
          end = Math.min(lastBreak + SENTENCE_BREAK.length(), length);
        }
      }

      String content = text.substring(start, end).trim();
      if (!content.isEmpty()) {
        chunks.add(new TextChunk(chunks.size(), content, start, end));
      }

      if (end >= length) {
        break;
      }
      start = Math.max(start + 1, end - overlap);
    }
    return chunks;
  }
}
