package com.flamingo.ai.coursepipeline.service.pipeline;

import com.flamingo.ai.coursepipeline.domain.enums.EntityType;
import com.flamingo.ai.coursepipeline.service.queue.JobPayload;
import java.util.UUID;

/**
 * Input of an embedding job.
 *
 * @param chapterId owning chapter, stored on every chunk
 * @param materialId material whose chunks are replaced
 * @param text text at the time the job was queued; the worker embeds the material's stored text
 * @param language content language
 */
public record EmbeddingJobPayload(UUID chapterId, UUID materialId, String text, String language)
    implements JobPayload {

  @Override
  public EntityType entityType() {
    return EntityType.MATERIAL;
  }

  @Override
  public UUID entityId() {
    return materialId;
  }
}
