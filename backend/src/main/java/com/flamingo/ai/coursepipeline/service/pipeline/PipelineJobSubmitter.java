package com.flamingo.ai.coursepipeline.service.pipeline;

import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.exception.DuplicateJobException;
import com.flamingo.ai.coursepipeline.service.queue.JobHandle;
import com.flamingo.ai.coursepipeline.service.queue.JobQueueService;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Submits extraction and embedding jobs. Dedupe keys are derived from the material id, so a
 * material never has two live jobs of the same type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineJobSubmitter {

  private final JobQueueService jobQueue;
  private final PipelineConfig pipelineConfig;

  /**
   * Queues text extraction of an uploaded material.
   *
   * @throws DuplicateJobException if an extraction job for the material is already live
   */
  public JobHandle enqueueExtraction(
      UUID materialId, String filePath, String mimeType, UUID chapterId, String courseLanguage) {
    JobHandle handle =
        jobQueue.enqueue(
            JobType.EXTRACTION,
            new ExtractionJobPayload(materialId, chapterId, filePath, mimeType, courseLanguage),
            dedupeKey(JobType.EXTRACTION, materialId),
            pipelineConfig.getQueue().getExtraction().getPriority());
    log.info("Queued extraction job {} for material {}", handle.jobId(), materialId);
    return handle;
  }

  /**
   * Queues chunking and embedding of a material's text.
   *
   * @param text extracted text at enqueue time, or null; the job always embeds the stored text
   * @throws DuplicateJobException if an embedding job for the material is already live
   */
  public JobHandle enqueueEmbedding(UUID chapterId, UUID materialId, String text, String language) {
    JobHandle handle =
        jobQueue.enqueue(
            JobType.EMBEDDING_GENERATION,
            new EmbeddingJobPayload(chapterId, materialId, text, language),
            dedupeKey(JobType.EMBEDDING_GENERATION, materialId),
            pipelineConfig.getQueue().getEmbedding().getPriority());
    log.info("Queued embedding job {} for material {}", handle.jobId(), materialId);
    return handle;
  }

  /**
   * Cancels a queued embedding job of a material whose text is about to be replaced.
   *
   * @return id of the cancelled job, or empty if none was queued
   */
  public Optional<String> cancelQueuedEmbedding(UUID materialId) {
    Optional<String> cancelled =
        jobQueue.cancelQueued(
            dedupeKey(JobType.EMBEDDING_GENERATION, materialId),
            "Superseded by reprocessing of material " + materialId);
    cancelled.ifPresent(
        jobId -> log.info("Cancelled embedding job {} of material {}", jobId, materialId));
    return cancelled;
  }

  static String dedupeKey(JobType jobType, UUID materialId) {
    return jobType.getKeyPrefix() + "-" + materialId;
  }
}
