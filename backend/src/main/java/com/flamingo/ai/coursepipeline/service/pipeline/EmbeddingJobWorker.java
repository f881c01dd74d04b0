package com.flamingo.ai.coursepipeline.service.pipeline;

import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.domain.entity.Material;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialContext;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialRepository;
import com.flamingo.ai.coursepipeline.exception.MaterialProcessingException;
import com.flamingo.ai.coursepipeline.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.coursepipeline.service.embedding.EmbeddingResult;
import com.flamingo.ai.coursepipeline.service.notification.ProgressEmitter;
import com.flamingo.ai.coursepipeline.service.queue.JobExecution;
import io.micrometer.core.annotation.Timed;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Chunks a material's text and replaces its chunks in the vector store.
 *
 * <p>The material row is never modified: a failed embedding job leaves the material completed, and
 * embeddings can be regenerated on their own later.
 */
@Component
@Slf4j
public class EmbeddingJobWorker extends AbstractMaterialJobWorker<EmbeddingJobPayload> {

  private final MaterialRepository materialRepository;
  private final EmbeddingGenerator embeddingGenerator;
  private final PipelineConfig pipelineConfig;

  public EmbeddingJobWorker(
      MaterialRepository materialRepository,
      EmbeddingGenerator embeddingGenerator,
      PipelineConfig pipelineConfig,
      ProgressEmitter progressEmitter) {
    super(progressEmitter);
    this.materialRepository = materialRepository;
    this.embeddingGenerator = embeddingGenerator;
    this.pipelineConfig = pipelineConfig;
  }

  @Override
  public JobType getJobType() {
    return JobType.EMBEDDING_GENERATION;
  }

  @Override
  public Class<EmbeddingJobPayload> getPayloadType() {
    return EmbeddingJobPayload.class;
  }

  @Override
  @Timed(value = "pipeline.embedding.job", description = "Time to run one embedding attempt")
  public void process(JobExecution<EmbeddingJobPayload> execution) {
    EmbeddingJobPayload payload = execution.getPayload();
    UUID materialId = payload.materialId();
    Optional<MaterialContext> found = materialRepository.findContextById(materialId);
    if (found.isEmpty()) {
      log.warn(
          "Material {} was deleted, skipping embedding job {}", materialId, execution.getJobId());
      return;
    }
    MaterialContext context = found.get();
    UUID userId = context.userId();

    reportStage(execution, userId, 10, "chunking", Map.of("materialId", materialId));
    String text = resolveText(payload, execution.getJobId());

    reportStage(execution, userId, 50, "generating_embeddings");
    EmbeddingResult result =
        embeddingGenerator.generate(
            context.courseId(),
            payload.chapterId(),
            materialId,
            text,
            () -> text.equals(currentText(materialId)));

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("materialId", materialId);
    data.put("chunksCreated", result.chunksAdded());
    data.put("collectionId", result.collectionId());
    progressEmitter.emitComplete(userId, execution.getJobId(), data);
  }

  @Override
  public void onExhausted(JobExecution<EmbeddingJobPayload> execution, String errorMessage) {
    UUID materialId = execution.getPayload().materialId();
    log.error(
        "Embedding of material {} failed after {} attempts, material keeps its text: {}",
        materialId,
        execution.getAttempt(),
        errorMessage);
    materialRepository
        .findContextById(materialId)
        .ifPresent(
            context ->
                progressEmitter.emitFailed(context.userId(), execution.getJobId(), errorMessage));
  }

  /**
   * Reads the material's current extracted text. A payload queued before a reprocess may carry an
   * older version, so the stored text always wins.
   */
  private String resolveText(EmbeddingJobPayload payload, String jobId) {
    UUID materialId = payload.materialId();
    Material material = materialRepository.findById(materialId).orElse(null);
    String text = material != null ? material.getExtractedText() : null;
    if (material == null
        || material.getStatus() != MaterialStatus.COMPLETED
        || text == null
        || text.length() < pipelineConfig.getExtraction().getMinTextLength()) {
      throw new MaterialProcessingException(
          materialId,
          "No extracted text available for embedding material " + materialId,
          "This material has no extracted text yet. Reprocess it first.");
    }
    if (payload.text() != null && !payload.text().equals(text)) {
      log.info(
          "Text of material {} changed since job {} was queued, embedding the stored text",
          materialId,
          jobId);
    }
    return text;
  }

  private String currentText(UUID materialId) {
    return materialRepository
        .findById(materialId)
        .filter(material -> material.getStatus() == MaterialStatus.COMPLETED)
        .map(Material::getExtractedText)
        .orElse(null);
  }
}
