package com.flamingo.ai.coursepipeline.service.embedding;

import com.flamingo.ai.coursepipeline.elasticsearch.MaterialChunk;
import java.util.List;
import java.util.UUID;

/**
 * Storage for material chunk embeddings.
 *
 * <p>A collection groups all chunks of one course. Chunks are owned by their material and are
 * removed or replaced as a unit.
 */
public interface VectorStore {

  /**
   * Returns the collection ID used for a course.
   *
   * @param courseId the course
   * @return {@code course_<courseId>}
   */
  static String collectionIdFor(UUID courseId) {
    return "course_" + courseId;
  }

  /**
   * Inserts or overwrites chunks in a collection. Visible to queries once this returns.
   *
   * @param collectionId target collection
   * @param chunks chunks with embeddings
   */
  void upsert(String collectionId, List<MaterialChunk> chunks);

  void deleteByMaterial(UUID materialId);

  /**
   * Finds the chunks nearest to a query vector.
   *
   * @param collectionId collection to search
   * @param queryVector query embedding
   * @param k maximum number of results
   * @return chunks ordered by similarity
   */
  List<MaterialChunk> query(String collectionId, List<Float> queryVector, int k);

  long countByMaterial(UUID materialId);
}
