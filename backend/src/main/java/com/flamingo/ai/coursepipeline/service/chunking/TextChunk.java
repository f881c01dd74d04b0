package com.flamingo.ai.coursepipeline.service.chunking;

/**
 * A bounded span of material text ready for embedding.
 *
 * @param index position of the chunk in the material, starting at 0
 * @param text trimmed chunk text, never blank
 * @param startChar inclusive start offset in the source text
 * @param endChar exclusive end offset in the source text
 */
public record TextChunk(int index, String text, int startChar, int endChar) {}
