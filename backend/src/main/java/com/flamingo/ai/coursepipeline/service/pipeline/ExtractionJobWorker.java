package com.flamingo.ai.coursepipeline.service.pipeline;

import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialContext;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialRepository;
import com.flamingo.ai.coursepipeline.exception.DuplicateJobException;
import com.flamingo.ai.coursepipeline.service.aggregation.ChapterAggregator;
import com.flamingo.ai.coursepipeline.service.extraction.ExtractionResult;
import com.flamingo.ai.coursepipeline.service.extraction.ExtractionService;
import com.flamingo.ai.coursepipeline.service.notification.ProgressEmitter;
import com.flamingo.ai.coursepipeline.service.queue.JobExecution;
import com.flamingo.ai.coursepipeline.service.structuring.ContentStructuringService;
import io.micrometer.core.annotation.Timed;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts, structures and stores the text of an uploaded material, then hands it to the
 * embedding queue.
 *
 * <p>Stages: started (5), extracting (10), processing_pages (40), structuring (60), saving (80),
 * queueing_embeddings (90). The material becomes completed together with its text in one update;
 * when the job runs out of attempts the material is marked failed with the last error.
 */
@Component
@Slf4j
public class ExtractionJobWorker extends AbstractMaterialJobWorker<ExtractionJobPayload> {

  private final MaterialRepository materialRepository;
  private final MaterialStatusWriter statusWriter;
  private final ExtractionService extractionService;
  private final ContentStructuringService structuringService;
  private final PipelineJobSubmitter jobSubmitter;
  private final ChapterAggregator chapterAggregator;
  private final PipelineConfig pipelineConfig;

  public ExtractionJobWorker(
      MaterialRepository materialRepository,
      MaterialStatusWriter statusWriter,
      ExtractionService extractionService,
      ContentStructuringService structuringService,
      PipelineJobSubmitter jobSubmitter,
      ChapterAggregator chapterAggregator,
      PipelineConfig pipelineConfig,
      ProgressEmitter progressEmitter) {
    super(progressEmitter);
    this.materialRepository = materialRepository;
    this.statusWriter = statusWriter;
    this.extractionService = extractionService;
    this.structuringService = structuringService;
    this.jobSubmitter = jobSubmitter;
    this.chapterAggregator = chapterAggregator;
    this.pipelineConfig = pipelineConfig;
  }

  @Override
  public JobType getJobType() {
    return JobType.EXTRACTION;
  }

  @Override
  public Class<ExtractionJobPayload> getPayloadType() {
    return ExtractionJobPayload.class;
  }

  @Override
  @Timed(value = "pipeline.extraction.job", description = "Time to run one extraction attempt")
  public void process(JobExecution<ExtractionJobPayload> execution) {
    ExtractionJobPayload payload = execution.getPayload();
    UUID materialId = payload.materialId();
    Optional<MaterialContext> found = materialRepository.findContextById(materialId);
    if (found.isEmpty()) {
      log.warn(
          "Material {} was deleted, skipping extraction job {}", materialId, execution.getJobId());
      return;
    }
    MaterialContext context = found.get();
    UUID userId = context.userId();
    log.info(
        "Extracting material {} (attempt {}/{})",
        materialId,
        execution.getAttempt(),
        execution.getMaxAttempts());

    reportStage(execution, userId, 5, "started", Map.of("materialId", materialId));
    statusWriter.markProcessing(materialId);

    reportStage(execution, userId, 10, "extracting");
    ExtractionResult extracted =
        extractionService.extract(materialId, Path.of(payload.filePath()), payload.mimeType());
    reportStage(
        execution,
        userId,
        40,
        "processing_pages",
        Map.of("totalPages", extracted.pageCount()));

    String rawText = capLength(materialId, extracted.fullText());

    reportStage(execution, userId, 60, "structuring");
    String language =
        payload.courseLanguage() != null ? payload.courseLanguage() : context.courseLanguage();
    String finalText = structure(materialId, rawText, language);

    reportStage(execution, userId, 80, "saving");
    if (!statusWriter.markCompleted(materialId, finalText)) {
      log.warn("Material {} was deleted during extraction, result discarded", materialId);
      return;
    }

    reportStage(execution, userId, 90, "queueing_embeddings");
    queueEmbedding(payload.chapterId(), materialId, finalText, language);
    chapterAggregator.aggregate(payload.chapterId());

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("materialId", materialId);
    result.put("textLength", finalText.length());
    result.put("pageCount", extracted.pageCount());
    progressEmitter.emitComplete(userId, execution.getJobId(), result);
    log.info("Material {} extracted: {} chars", materialId, finalText.length());
  }

  @Override
  public void onExhausted(JobExecution<ExtractionJobPayload> execution, String errorMessage) {
    ExtractionJobPayload payload = execution.getPayload();
    UUID materialId = payload.materialId();
    log.error(
        "Extraction of material {} failed after {} attempts: {}",
        materialId,
        execution.getAttempt(),
        errorMessage);
    if (!statusWriter.markFailed(materialId, errorMessage)) {
      return;
    }
    chapterAggregator.aggregate(payload.chapterId());
    materialRepository
        .findContextById(materialId)
        .ifPresent(
            context ->
                progressEmitter.emitFailed(context.userId(), execution.getJobId(), errorMessage));
  }

  private String capLength(UUID materialId, String text) {
    int maxLength = pipelineConfig.getExtraction().getMaxTextLength();
    if (text.length() <= maxLength) {
      return text;
    }
    log.warn(
        "Extracted text of material {} truncated from {} to {} chars",
        materialId,
        text.length(),
        maxLength);
    return text.substring(0, maxLength).trim();
  }

  /** Structures the text; output that normalizes below the minimum length is discarded. */
  private String structure(UUID materialId, String rawText, String language) {
    String structured =
        ExtractionService.normalize(structuringService.structureContent(rawText, language));
    if (structured.length() < pipelineConfig.getExtraction().getMinTextLength()) {
      log.warn("Structured text of material {} too short, keeping extracted text", materialId);
      return rawText;
    }
    return structured;
  }

  private void queueEmbedding(UUID chapterId, UUID materialId, String text, String language) {
    try {
      jobSubmitter.enqueueEmbedding(chapterId, materialId, text, language);
    } catch (DuplicateJobException e) {
      log.info(
          "Embedding job {} already queued for material {}, not queueing another",
          e.getExistingJobId(),
          materialId);
    }
  }
}
