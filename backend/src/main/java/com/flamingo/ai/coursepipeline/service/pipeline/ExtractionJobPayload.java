package com.flamingo.ai.coursepipeline.service.pipeline;

import com.flamingo.ai.coursepipeline.domain.enums.EntityType;
import com.flamingo.ai.coursepipeline.service.queue.JobPayload;
import java.util.UUID;

/**
 * Input of an extraction job.
 *
 * @param materialId material to extract
 * @param chapterId owning chapter, re-aggregated when the job ends
 * @param filePath location of the stored upload
 * @param mimeType declared MIME type of the upload
 * @param courseLanguage language passed to content structuring
 */
public record ExtractionJobPayload(
    UUID materialId, UUID chapterId, String filePath, String mimeType, String courseLanguage)
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
