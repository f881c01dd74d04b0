package com.flamingo.ai.coursepipeline.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.domain.entity.Material;
import com.flamingo.ai.coursepipeline.domain.enums.JobType;
import com.flamingo.ai.coursepipeline.domain.enums.MaterialStatus;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialContext;
import com.flamingo.ai.coursepipeline.domain.repository.MaterialRepository;
import com.flamingo.ai.coursepipeline.exception.EmbeddingServiceUnavailableException;
import com.flamingo.ai.coursepipeline.exception.MaterialProcessingException;
import com.flamingo.ai.coursepipeline.service.embedding.EmbeddingGenerator;
import com.flamingo.ai.coursepipeline.service.embedding.EmbeddingResult;
import com.flamingo.ai.coursepipeline.service.notification.ProgressEmitter;
import com.flamingo.ai.coursepipeline.service.queue.JobExecution;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("EmbeddingJobWorker Tests")
class EmbeddingJobWorkerTest {

  private static final String TEXT =
      "Osmosis is the movement of water across a semipermeable membrane toward higher solute.";

  @Mock private MaterialRepository materialRepository;
  @Mock private EmbeddingGenerator embeddingGenerator;
  @Mock private ProgressEmitter progressEmitter;

  private EmbeddingJobWorker worker;
  private MaterialContext context;

  @BeforeEach
  void setUp() {
    worker =
        new EmbeddingJobWorker(
            materialRepository, embeddingGenerator, new PipelineConfig(), progressEmitter);
    context =
        new MaterialContext(
            UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), "en");
    when(materialRepository.findContextById(context.materialId())).thenReturn(Optional.of(context));
  }

  private JobExecution<EmbeddingJobPayload> execution(String text) {
    return new JobExecution<>(
        "embed-job",
        JobType.EMBEDDING_GENERATION,
        new EmbeddingJobPayload(context.chapterId(), context.materialId(), text, "en"),
        1,
        3,
        progress -> {});
  }

  private void storedText(MaterialStatus status, String text) {
    when(materialRepository.findById(context.materialId()))
        .thenReturn(
            Optional.of(
                Material.builder()
                    .id(context.materialId())
                    .status(status)
                    .extractedText(text)
                    .build()));
  }

  @Test
  @DisplayName("Should embed the stored text into the course collection")
  void shouldEmbedStoredText() throws Exception {
    storedText(MaterialStatus.COMPLETED, TEXT);
    when(embeddingGenerator.generate(
            eq(context.courseId()),
            eq(context.chapterId()),
            eq(context.materialId()),
            eq(TEXT),
            any()))
        .thenReturn(new EmbeddingResult(1, "course_" + context.courseId()));

    worker.process(execution(TEXT));

    verify(progressEmitter)
        .emitComplete(
            eq(context.userId()),
            eq("embed-job"),
            argThat(data -> Integer.valueOf(1).equals(data.get("chunksCreated"))));
  }

  @Test
  @DisplayName("Should embed the stored text when the job carries an older version")
  void shouldPreferStoredText_whenPayloadTextIsStale() throws Exception {
    storedText(MaterialStatus.COMPLETED, TEXT);
    when(embeddingGenerator.generate(any(), any(), any(), anyString(), any()))
        .thenReturn(new EmbeddingResult(1, "course_" + context.courseId()));

    worker.process(execution("Version A of the material, replaced by a later reprocess."));

    verify(embeddingGenerator)
        .generate(
            eq(context.courseId()),
            eq(context.chapterId()),
            eq(context.materialId()),
            eq(TEXT),
            any());
  }

  @Test
  @DisplayName("Should write only while the embedded text is still the stored text")
  void shouldGuardWriteWithCurrentText() throws Exception {
    storedText(MaterialStatus.COMPLETED, TEXT);
    ArgumentCaptor<BooleanSupplier> guard = ArgumentCaptor.forClass(BooleanSupplier.class);
    when(embeddingGenerator.generate(any(), any(), any(), anyString(), guard.capture()))
        .thenReturn(new EmbeddingResult(1, "course_" + context.courseId()));

    worker.process(execution(null));

    assertThat(guard.getValue().getAsBoolean()).isTrue();
    storedText(MaterialStatus.PENDING, null);
    assertThat(guard.getValue().getAsBoolean()).isFalse();
  }

  @Test
  @DisplayName("Should fail the attempt while the material is being extracted again")
  void shouldFail_whenMaterialNotCompleted() {
    storedText(MaterialStatus.PROCESSING, null);

    assertThatThrownBy(() -> worker.process(execution(TEXT)))
        .isInstanceOf(MaterialProcessingException.class);
    verifyNoInteractions(embeddingGenerator);
  }

  @Test
  @DisplayName("Should fail the attempt when no text is available")
  void shouldFail_whenNoTextAvailable() {
    when(materialRepository.findById(context.materialId())).thenReturn(Optional.empty());

    assertThatThrownBy(() -> worker.process(execution("")))
        .isInstanceOf(MaterialProcessingException.class);
    verifyNoInteractions(embeddingGenerator);
  }

  @Test
  @DisplayName("Should let backend outages propagate for retry")
  void shouldPropagateOutage() {
    storedText(MaterialStatus.COMPLETED, TEXT);
    when(embeddingGenerator.generate(any(), any(), any(), anyString(), any()))
        .thenThrow(new EmbeddingServiceUnavailableException("down"));

    assertThatThrownBy(() -> worker.process(execution(TEXT)))
        .isInstanceOf(EmbeddingServiceUnavailableException.class);
  }

  @Test
  @DisplayName("Should skip a job whose material was deleted")
  void shouldSkip_whenMaterialDeleted() throws Exception {
    when(materialRepository.findContextById(context.materialId())).thenReturn(Optional.empty());

    worker.process(execution(TEXT));

    verifyNoInteractions(embeddingGenerator, progressEmitter);
  }

  @Test
  @DisplayName("Should only notify when attempts are exhausted, leaving the material alone")
  void shouldOnlyNotify_whenExhausted() {
    worker.onExhausted(execution(TEXT), "Embedding service unavailable");

    verify(progressEmitter)
        .emitFailed(context.userId(), "embed-job", "Embedding service unavailable");
    verify(materialRepository, never()).markFailed(any(), anyString(), any());
    verify(progressEmitter, never())
        .emitComplete(any(), anyString(), anyMap());
  }
}
