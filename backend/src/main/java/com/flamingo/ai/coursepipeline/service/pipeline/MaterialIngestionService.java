package com.flamingo.ai.coursepipeline.service.pipeline;

import com.flamingo.ai.coursepipeline.domain.entity.Chapter;
import com.flamingo.ai.coursepipeline.domain.entity.Material;
import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import com.flamingo.ai.coursepipeline.domain.repository.ChapterRepository;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialContext;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialRepository;
import com.flamingo.ai.coursepipeline.exception.ChapterNotFoundException;
import com.flamingo.ai.coursepipeline.exception.InvalidMaterialStateException;
import com.flamingo.ai.coursepipeline.exception.MaterialNotFoundException;
import com.flamingo.ai.coursepipeline.exception.MaterialProcessingException;
import com.flamingo.ai.coursepipeline.exception.UnsupportedFormatException;
import com.flamingo.ai.coursepipeline.service.aggregation.ChapterAggregator;
import com.flamingo.ai.coursepipeline.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.coursepipeline.service.extraction.ExtractionService;
import com.flamingo.ai.coursepipeline.service.queue.JobHandle;
import com.flamingo.ai.coursepipeline.service.storage.UploadStorageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.multipart.MultipartFile;

/**
 * Entry point for material uploads and the manual recovery actions on materials.
 *
 * <p>Methods are not transactional as a whole. Each database write commits before the next job is
 * queued, so a claimed job always finds its material.
 */
@Service
@Slf4j
public class MaterialIngestionService {

  private static final long MAX_FILE_SIZE = 50L * 1024 * 1024;

  private final MaterialRepository materialRepository;
  private final ChapterRepository chapterRepository;
  private final UploadStorageService storageService;
  private final ExtractionService extractionService;
  private final PipelineJobSubmitter jobSubmitter;
  private final MaterialStatusWriter statusWriter;
  private final EmbeddingGenerator embeddingGenerator;
  private final ChapterAggregator chapterAggregator;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  public MaterialIngestionService(
      MaterialRepository materialRepository,
      ChapterRepository chapterRepository,
      UploadStorageService storageService,
      ExtractionService extractionService,
      PipelineJobSubmitter jobSubmitter,
      MaterialStatusWriter statusWriter,
      EmbeddingGenerator embeddingGenerator,
      ChapterAggregator chapterAggregator,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.materialRepository = materialRepository;
    this.chapterRepository = chapterRepository;
    this.storageService = storageService;
    this.extractionService = extractionService;
    this.jobSubmitter = jobSubmitter;
    this.statusWriter = statusWriter;
    this.embeddingGenerator = embeddingGenerator;
    this.chapterAggregator = chapterAggregator;
    this.meterRegistry = meterRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Stores an upload, creates its pending material and queues extraction.
   *
   * @throws ChapterNotFoundException if the chapter does not exist
   * @throws UnsupportedFormatException if no extractor handles the file's MIME type
   */
  @Timed(value = "material.upload", description = "Time to accept a material upload")
  public MaterialUpload submitUpload(UUID chapterId, MultipartFile file) {
    log.info("Uploading material {} to chapter {}", file.getOriginalFilename(), chapterId);
    if (!chapterRepository.existsById(chapterId)) {
      throw new ChapterNotFoundException(chapterId);
    }
    validateFile(file);

    Path stored = storageService.store(chapterId, file);
    Material material;
    String courseLanguage;
    try {
      Created created =
          transactionTemplate.execute(status -> createMaterial(chapterId, file, stored));
      material = created.material();
      courseLanguage = created.courseLanguage();
    } catch (RuntimeException e) {
      storageService.delete(stored.toString());
      throw e;
    }
    meterRegistry
        .counter("material.uploaded", "type", fileType(material.getMimeType()))
        .increment();

    JobHandle job =
        jobSubmitter.enqueueExtraction(
            material.getId(),
            material.getFilePath(),
            material.getMimeType(),
            chapterId,
            courseLanguage);
    chapterAggregator.aggregate(chapterId);

    log.info("Material {} created with ID: {}", material.getFileName(), material.getId());
    return new MaterialUpload(material, job);
  }

  private Created createMaterial(UUID chapterId, MultipartFile file, Path stored) {
    Chapter chapter =
        chapterRepository
            .findById(chapterId)
            .orElseThrow(() -> new ChapterNotFoundException(chapterId));
    Material material =
        Material.builder()
            .chapter(chapter)
            .fileName(file.getOriginalFilename())
            .filePath(stored.toString())
            .mimeType(file.getContentType())
            .fileSize(file.getSize())
            .build();
    return new Created(materialRepository.save(material), chapter.getCourse().getLanguage());
  }

  public Material getMaterial(UUID materialId) {
    return materialRepository
        .findById(materialId)
        .orElseThrow(() -> new MaterialNotFoundException(materialId));
  }

  public Chapter getChapter(UUID chapterId) {
    return chapterRepository
        .findById(chapterId)
        .orElseThrow(() -> new ChapterNotFoundException(chapterId));
  }

  public List<Material> getMaterialsByChapter(UUID chapterId) {
    if (!chapterRepository.existsById(chapterId)) {
      throw new ChapterNotFoundException(chapterId);
    }
    return materialRepository.findByChapterIdOrderByCreatedAtAsc(chapterId);
  }

  /**
   * Runs extraction again from the stored upload. A queued embedding job of the old text is
   * cancelled, the material's chunks are removed and it returns to pending until the new job
   * finishes.
   *
   * @throws InvalidMaterialStateException if the material is being processed
   */
  @Timed(value = "material.reprocess", description = "Time to queue a material reprocess")
  public JobHandle reprocessMaterial(UUID materialId) {
    Material material = getMaterial(materialId);
    if (material.getStatus() == MaterialStatus.PROCESSING) {
      throw new InvalidMaterialStateException(
          materialId,
          material.getStatus(),
          "This material is being processed. Try again when it has finished.");
    }
    MaterialContext context = context(materialId);

    jobSubmitter.cancelQueuedEmbedding(materialId);
    embeddingGenerator.removeMaterial(materialId);
    statusWriter.resetToPending(materialId);
    JobHandle job =
        jobSubmitter.enqueueExtraction(
            materialId,
            material.getFilePath(),
            material.getMimeType(),
            context.chapterId(),
            context.courseLanguage());
    chapterAggregator.aggregate(context.chapterId());
    meterRegistry.counter("material.reprocessed").increment();
    log.info("Material {} queued for reprocessing as job {}", materialId, job.jobId());
    return job;
  }

  /**
   * Rebuilds a completed material's chunks from its stored text without extracting again.
   *
   * @throws InvalidMaterialStateException if the material is not completed
   */
  public JobHandle regenerateEmbeddings(UUID materialId) {
    Material material = getMaterial(materialId);
    if (material.getStatus() != MaterialStatus.COMPLETED) {
      throw new InvalidMaterialStateException(
          materialId,
          material.getStatus(),
          "Embeddings can only be regenerated for processed materials.");
    }
    MaterialContext context = context(materialId);
    JobHandle job =
        jobSubmitter.enqueueEmbedding(
            context.chapterId(), materialId, null, context.courseLanguage());
    log.info("Material {} queued for embedding regeneration as job {}", materialId, job.jobId());
    return job;
  }

  /** Deletes a material with its chunks and stored file, then re-aggregates its chapter. */
  @Timed(value = "material.delete", description = "Time to delete a material")
  public void deleteMaterial(UUID materialId) {
    Material material = getMaterial(materialId);
    MaterialContext context = context(materialId);

    embeddingGenerator.removeMaterial(materialId);
    materialRepository.deleteById(materialId);
    storageService.delete(material.getFilePath());
    chapterAggregator.aggregate(context.chapterId());

    meterRegistry.counter("material.deleted").increment();
    log.info("Deleted material: {}", materialId);
  }

  private MaterialContext context(UUID materialId) {
    return materialRepository
        .findContextById(materialId)
        .orElseThrow(() -> new MaterialNotFoundException(materialId));
  }

  private void validateFile(MultipartFile file) {
    if (file.isEmpty()) {
      throw new MaterialProcessingException(null, "File is empty", "Please upload a valid file");
    }
    String contentType = file.getContentType();
    if (contentType == null || !extractionService.supports(contentType)) {
      throw new UnsupportedFormatException(
          null, contentType, "Unsupported mime type: " + contentType);
    }
    if (file.getSize() > MAX_FILE_SIZE) {
      throw new MaterialProcessingException(
          null, "File too large: " + file.getSize(), "Maximum file size is 50MB");
    }
  }

  private String fileType(String mimeType) {
    if (mimeType == null) {
      return "unknown";
    }
    return switch (mimeType) {
      case "application/pdf" -> "pdf";
      case "application/vnd.openxmlformats-officedocument.wordprocessingml.document" -> "docx";
      case "application/msword" -> "doc";
      default -> "other";
    };
  }

  /**
   * A freshly uploaded material with its extraction job.
   *
   * @param material the pending material
   * @param extractionJob the queued extraction job
   */
  public record MaterialUpload(Material material, JobHandle extractionJob) {}

  private record Created(Material material, String courseLanguage) {}
}
