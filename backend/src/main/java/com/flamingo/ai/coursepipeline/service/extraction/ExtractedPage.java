package com.flamingo.ai.coursepipeline.service.extraction;

/**
 * Text of a single page (PDF) or section (DOCX) of an extracted file.
 *
 * @param index one-based page or section number
 * @param text trimmed page text
 */
public record ExtractedPage(int index, String text) {}
