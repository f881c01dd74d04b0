package com.flamingo.ai.coursepipeline.elasticsearch;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk of material text stored in Elasticsearch together with its embedding.
 *
 * <p>The ID is derived from the material ID and chunk index, so re-indexing the same chunk
 * overwrites it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaterialChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String collectionId;
  private UUID courseId;
  private UUID chapterId;
  private UUID materialId;
  private int chunkIndex;
  private String content;
  private int startChar;
  private int endChar;
  private List<Float> embedding;

  @Builder.Default private Double relevanceScore = 0.0;

  public static String chunkId(UUID materialId, int chunkIndex) {
    return materialId + "_" + chunkIndex;
  }
}
