package com.flamingo.ai.coursepipeline.service.structuring;

/**
 * Best-effort enhancement pass that reorganizes raw extracted text into structured Markdown.
 *
 * <p>Implementations never throw: on any failure (timeout, malformed output, model error) the input
 * text is returned unchanged so the surrounding job continues.
 */
public interface ContentStructuringService {

  /**
   * Structures the given text.
   *
   * @param rawText extracted text
   * @param language course language code, e.g. {@code en} or {@code fr}
   * @return structured text, or {@code rawText} unchanged if structuring was skipped or failed
   */
  String structureContent(String rawText, String language);
}
