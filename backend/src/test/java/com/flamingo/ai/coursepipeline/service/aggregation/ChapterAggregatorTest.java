package com.flamingo.ai.coursepipeline.service.aggregation;

import static com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus.COMPLETED;
import static com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus.FAILED;
import static com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus.PENDING;
import static com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus.PROCESSING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.coursepipeline.domain.entity.Chapter;
import com.flamingo.ai.coursepipeline.domain.entity.Course;
import com.flamingo.ai.coursepipeline.domain.entity.Material;
import com.flamingo.ai.coursepipeline.domain.enums.ChapterStatus;
import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import com.flamingo.ai.coursepipeline.domain.repository.ChapterRepository;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialRepository;
import com.flamingo.ai.coursepipeline.exception.ChapterNotFoundException;
import com.flamingo.ai.coursepipeline.service.notification.ProgressEmitter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ChapterAggregator Tests")
class ChapterAggregatorTest {

  @Nested
  @DisplayName("deriveStatus")
  class DeriveStatus {

    @Test
    @DisplayName("Should be draft when the chapter has no materials")
    void shouldBeDraft_whenNoMaterials() {
      assertThat(ChapterAggregator.deriveStatus(List.of(), ChapterStatus.PROCESSING))
          .isEqualTo(ChapterStatus.DRAFT);
    }

    @Test
    @DisplayName("Should be ready when every material is completed")
    void shouldBeReady_whenAllCompleted() {
      assertThat(
              ChapterAggregator.deriveStatus(
                  List.of(COMPLETED, COMPLETED), ChapterStatus.PROCESSING))
          .isEqualTo(ChapterStatus.READY);
    }

    @Test
    @DisplayName("Should be processing while any material is pending or processing")
    void shouldBeProcessing_whenAnyInFlight() {
      assertThat(ChapterAggregator.deriveStatus(List.of(COMPLETED, PENDING), ChapterStatus.DRAFT))
          .isEqualTo(ChapterStatus.PROCESSING);
      assertThat(
              ChapterAggregator.deriveStatus(List.of(PROCESSING, COMPLETED), ChapterStatus.READY))
          .isEqualTo(ChapterStatus.PROCESSING);
    }

    @Test
    @DisplayName("Should stay processing when a failed material remains and none are in flight")
    void shouldBeProcessing_whenFailedMaterialRemains() {
      assertThat(ChapterAggregator.deriveStatus(List.of(COMPLETED, FAILED), ChapterStatus.DRAFT))
          .isEqualTo(ChapterStatus.PROCESSING);
      assertThat(ChapterAggregator.deriveStatus(List.of(FAILED), ChapterStatus.PROCESSING))
          .isEqualTo(ChapterStatus.PROCESSING);
    }

    @ParameterizedTest
    @EnumSource(MaterialStatus.class)
    @DisplayName("Should never leave completed, whatever the materials")
    void shouldKeepCompleted(MaterialStatus status) {
      assertThat(ChapterAggregator.deriveStatus(List.of(status), ChapterStatus.COMPLETED))
          .isEqualTo(ChapterStatus.COMPLETED);
      assertThat(ChapterAggregator.deriveStatus(List.of(), ChapterStatus.COMPLETED))
          .isEqualTo(ChapterStatus.COMPLETED);
    }
  }

  @Nested
  @DisplayName("aggregate")
  class Aggregate {

    @Mock private ChapterRepository chapterRepository;
    @Mock private MaterialRepository materialRepository;
    @Mock private ProgressEmitter progressEmitter;
    @Mock private PlatformTransactionManager transactionManager;

    private ChapterAggregator aggregator;
    private UUID chapterId;
    private Chapter chapter;
    private Course course;

    @BeforeEach
    void setUp() {
      aggregator =
          new ChapterAggregator(
              chapterRepository,
              materialRepository,
              progressEmitter,
              new SimpleMeterRegistry(),
              transactionManager);
      chapterId = UUID.randomUUID();
      course =
          Course.builder()
              .id(UUID.randomUUID())
              .userId(UUID.randomUUID())
              .name("Biology 101")
              .build();
      chapter =
          Chapter.builder()
              .id(chapterId)
              .course(course)
              .title("Cells")
              .status(ChapterStatus.PROCESSING)
              .build();
      when(chapterRepository.findById(chapterId)).thenReturn(Optional.of(chapter));
    }

    @Test
    @DisplayName("Should merge completed materials in upload order when becoming ready")
    void shouldMergeContent_whenBecomingReady() {
      when(materialRepository.findStatusesByChapterId(chapterId))
          .thenReturn(List.of(COMPLETED, COMPLETED));
      when(materialRepository.findByChapterIdOrderByCreatedAtAsc(chapterId))
          .thenReturn(List.of(material("First part"), material("Second part")));

      AggregationResult result = aggregator.aggregate(chapterId);

      assertThat(result.becameReady()).isTrue();
      verify(chapterRepository).markReady(chapterId, "First part\n\n---\n\nSecond part");
      verify(progressEmitter)
          .emitChapterReady(course.getUserId(), course.getId(), chapterId, "Cells", "Biology 101");
    }

    @Test
    @DisplayName("Should not notify again when an already ready chapter is recomputed")
    void shouldNotNotify_whenAlreadyReady() {
      chapter.setStatus(ChapterStatus.READY);
      chapter.setProcessedContent("Only part");
      when(materialRepository.findStatusesByChapterId(chapterId)).thenReturn(List.of(COMPLETED));
      when(materialRepository.findByChapterIdOrderByCreatedAtAsc(chapterId))
          .thenReturn(List.of(material("Only part")));

      AggregationResult result = aggregator.aggregate(chapterId);

      assertThat(result.changed()).isFalse();
      verify(chapterRepository, never()).markReady(any(), anyString());
      verify(progressEmitter, never())
          .emitChapterReady(any(), any(), any(), anyString(), anyString());
    }

    @Test
    @DisplayName("Should fall back to draft when the last material is removed")
    void shouldFallBackToDraft_whenNoMaterialsLeft() {
      chapter.setStatus(ChapterStatus.READY);
      when(materialRepository.findStatusesByChapterId(chapterId)).thenReturn(List.of());

      AggregationResult result = aggregator.aggregate(chapterId);

      assertThat(result.current()).isEqualTo(ChapterStatus.DRAFT);
      verify(chapterRepository).updateDerivedStatus(chapterId, ChapterStatus.DRAFT);
    }

    @Test
    @DisplayName("Should leave a completed chapter untouched")
    void shouldLeaveCompletedChapter() {
      chapter.setStatus(ChapterStatus.COMPLETED);
      when(materialRepository.findStatusesByChapterId(chapterId)).thenReturn(List.of(PENDING));

      AggregationResult result = aggregator.aggregate(chapterId);

      assertThat(result.current()).isEqualTo(ChapterStatus.COMPLETED);
      verify(chapterRepository, never()).updateDerivedStatus(any(), any());
      verify(chapterRepository, never()).markReady(any(), anyString());
    }

    @Test
    @DisplayName("Should throw when the chapter does not exist")
    void shouldThrow_whenChapterMissing() {
      UUID missing = UUID.randomUUID();
      when(chapterRepository.findById(missing)).thenReturn(Optional.empty());

      assertThatThrownBy(() -> aggregator.aggregate(missing))
          .isInstanceOf(ChapterNotFoundException.class);
    }

    private Material material(String text) {
      return Material.builder()
          .id(UUID.randomUUID())
          .chapter(chapter)
          .status(COMPLETED)
          .extractedText(text)
          .build();
    }
  }

  @Test
  @DisplayName("Should skip materials without text when merging")
  void shouldSkipMaterialsWithoutText() {
    Material failed = Material.builder().status(FAILED).build();
    Material done = Material.builder().status(COMPLETED).extractedText("Body").build();

    assertThat(ChapterAggregator.mergeContent(List.of(failed, done))).isEqualTo("Body");
  }
}
