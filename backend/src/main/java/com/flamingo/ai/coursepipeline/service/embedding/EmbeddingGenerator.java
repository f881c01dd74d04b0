package com.flamingo.ai.coursepipeline.service.embedding;

import com.flamingo.ai.coursepipeline.elasticsearch.MaterialChunk;
import com.flamingo.ai.coursepipeline.exception.MaterialProcessingException;
import com.flamingo.ai.coursepipeline.service.chunking.SlidingWindowChunker;
import com.flamingo.ai.coursepipeline.service.chunking.TextChunk;
import com.google.common.util.concurrent.Striped;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.concurrent.locks.Lock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chunks a material's text, embeds the chunks and replaces the material's chunk set in the vector
 * store.
 *
 * <p>Embeddings are computed before any stored data is touched, so an unreachable backend leaves
 * existing chunks in place. The delete-then-insert runs under a per-material lock, after checking
 * that the embedded text is still the material's current text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingGenerator {

  private final SlidingWindowChunker chunker;
  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;

  private final Striped<Lock> materialLocks = Striped.lazyWeakLock(64);

  /**
   * Replaces the material's chunks with chunks of {@code text}.
   *
   * @param textStillCurrent checked under the material lock before writing
   * @throws MaterialProcessingException if the text was superseded while it was being embedded
   */
  public EmbeddingResult generate(
      UUID courseId,
      UUID chapterId,
      UUID materialId,
      String text,
      BooleanSupplier textStillCurrent) {
    String collectionId = VectorStore.collectionIdFor(courseId);
    List<TextChunk> chunks = chunker.chunk(text);

    List<List<Float>> vectors =
        embeddingService.embedPassages(chunks.stream().map(TextChunk::text).toList());

    List<MaterialChunk> documents = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      documents.add(
          MaterialChunk.builder()
              .id(MaterialChunk.chunkId(materialId, chunk.index()))
              .collectionId(collectionId)
              .courseId(courseId)
              .chapterId(chapterId)
              .materialId(materialId)
              .chunkIndex(chunk.index())
              .content(chunk.text())
              .startChar(chunk.startChar())
              .endChar(chunk.endChar())
              .embedding(vectors.get(i))
              .build());
    }

    Lock lock = materialLocks.get(materialId);
    lock.lock();
    try {
      if (!textStillCurrent.getAsBoolean()) {
        throw new MaterialProcessingException(
            materialId,
            "Text of material " + materialId + " changed while it was being embedded",
            "This material was reprocessed. Its embeddings will be rebuilt.");
      }
      vectorStore.deleteByMaterial(materialId);
      if (!documents.isEmpty()) {
        vectorStore.upsert(collectionId, documents);
      }
    } finally {
      lock.unlock();
    }

    log.info(
        "Stored {} chunks for material {} in collection {}",
        documents.size(),
        materialId,
        collectionId);
    return new EmbeddingResult(documents.size(), collectionId);
  }

  /** Removes all chunks of a material under the same lock used for replacement. */
  public void removeMaterial(UUID materialId) {
    Lock lock = materialLocks.get(materialId);
    lock.lock();
    try {
      vectorStore.deleteByMaterial(materialId);
    } finally {
      lock.unlock();
    }
  }
}
