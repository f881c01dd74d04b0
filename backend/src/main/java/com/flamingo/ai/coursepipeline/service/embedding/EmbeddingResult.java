package com.flamingo.ai.coursepipeline.service.embedding;

/**
 * Outcome of embedding one material.
 *
 * @param chunksAdded number of chunks written to the vector store
 * @param collectionId collection the chunks were written to
 */
public record EmbeddingResult(int chunksAdded, String collectionId) {}
