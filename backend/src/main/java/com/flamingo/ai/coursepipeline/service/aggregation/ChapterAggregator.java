package com.flamingo.ai.coursepipeline.service.aggregation;

import com.flamingo.ai.coursepipeline.domain.entity.Chapter;
import com.flamingo.ai.coursepipeline.domain.entity.Course;
import com.flamingo.ai.coursepipeline.domain.entity.Material;
import com.flamingo.ai.coursepipeline.domain.enums.ChapterStatus;
import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import com.flamingo.ai.coursepipeline.domain.repository.ChapterRepository;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialRepository;
import com.flamingo.ai.coursepipeline.exception.ChapterNotFoundException;
import com.flamingo.ai.coursepipeline.service.notification.ProgressEmitter;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Recomputes a chapter's status from its materials.
 *
 * <p>A chapter is ready only when every one of its materials is completed; failed materials keep
 * it processing until they are reprocessed or deleted. On becoming ready the extracted text of
 * all materials is merged into the chapter's processed content in upload order. A chapter the
 * user marked completed is never touched.
 */
@Service
@Slf4j
public class ChapterAggregator {

  @VisibleForTesting static final String CONTENT_DELIMITER = "\n\n---\n\n";

  private final ChapterRepository chapterRepository;
  private final MaterialRepository materialRepository;
  private final ProgressEmitter progressEmitter;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  private final Striped<Lock> chapterLocks = Striped.lazyWeakLock(32);

  public ChapterAggregator(
      ChapterRepository chapterRepository,
      MaterialRepository materialRepository,
      ProgressEmitter progressEmitter,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.chapterRepository = chapterRepository;
    this.materialRepository = materialRepository;
    this.progressEmitter = progressEmitter;
    this.meterRegistry = meterRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Derives a chapter status from the statuses of its materials.
   *
   * @param materialStatuses statuses of all materials of the chapter, in any order
   * @param current the chapter's stored status
   * @return the status the chapter should have
   */
  public static ChapterStatus deriveStatus(
      List<MaterialStatus> materialStatuses, ChapterStatus current) {
    if (current == ChapterStatus.COMPLETED) {
      return ChapterStatus.COMPLETED;
    }
    if (materialStatuses.isEmpty()) {
      return ChapterStatus.DRAFT;
    }
    boolean allCompleted =
        materialStatuses.stream().allMatch(status -> status == MaterialStatus.COMPLETED);
    return allCompleted ? ChapterStatus.READY : ChapterStatus.PROCESSING;
  }

  /**
   * Recomputes and stores the status of a chapter, merging its content when it is ready.
   *
   * @throws ChapterNotFoundException if the chapter does not exist
   */
  public AggregationResult aggregate(UUID chapterId) {
    Outcome outcome;
    Lock lock = chapterLocks.get(chapterId);
    lock.lock();
    try {
      outcome = transactionTemplate.execute(status -> recompute(chapterId));
    } finally {
      lock.unlock();
    }

    AggregationResult result = outcome.result();
    if (result.changed()) {
      log.info("Chapter {} status {} -> {}", chapterId, result.previous(), result.current());
      meterRegistry
          .counter("chapter.status.transitions", "status", result.current().name())
          .increment();
    }
    if (result.becameReady()) {
      Recipient recipient = outcome.recipient();
      progressEmitter.emitChapterReady(
          recipient.userId(),
          recipient.courseId(),
          chapterId,
          recipient.chapterTitle(),
          recipient.courseName());
    }
    return result;
  }

  private Outcome recompute(UUID chapterId) {
    Chapter chapter =
        chapterRepository
            .findById(chapterId)
            .orElseThrow(() -> new ChapterNotFoundException(chapterId));
    Course course = chapter.getCourse();
    Recipient recipient =
        new Recipient(course.getUserId(), course.getId(), chapter.getTitle(), course.getName());
    ChapterStatus previous = chapter.getStatus();
    String storedContent = chapter.getProcessedContent();

    List<MaterialStatus> statuses = materialRepository.findStatusesByChapterId(chapterId);
    ChapterStatus next = deriveStatus(statuses, previous);

    if (next == ChapterStatus.READY) {
      String merged =
          mergeContent(materialRepository.findByChapterIdOrderByCreatedAtAsc(chapterId));
      // Already-ready chapters are re-merged when the material set changed underneath them.
      if (previous != ChapterStatus.READY || !merged.equals(storedContent)) {
        chapterRepository.markReady(chapterId, merged);
      }
    } else if (next != previous) {
      chapterRepository.updateDerivedStatus(chapterId, next);
    }
    return new Outcome(
        new AggregationResult(chapterId, previous, next, statuses.size()), recipient);
  }

  @VisibleForTesting
  static String mergeContent(List<Material> materials) {
    return materials.stream()
        .filter(m -> m.getStatus() == MaterialStatus.COMPLETED)
        .map(Material::getExtractedText)
        .filter(text -> text != null && !text.isBlank())
        .collect(Collectors.joining(CONTENT_DELIMITER));
  }

  private record Recipient(UUID userId, UUID courseId, String chapterTitle, String courseName) {}

  private record Outcome(AggregationResult result, Recipient recipient) {}
}
