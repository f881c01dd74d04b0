package com.flamingo.ai.coursepipeline.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.coursepipeline.exception.EmbeddingServiceUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    embeddingService = new EmbeddingService(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("Should embed passages in one batch, preserving order")
  void shouldEmbedPassagesInOrder() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(
                    Embedding.from(new float[] {0.1f, 0.2f}),
                    Embedding.from(new float[] {0.3f, 0.4f}))));

    List<List<Float>> vectors = embeddingService.embedPassages(List.of("first", "second"));

    assertThat(vectors).containsExactly(List.of(0.1f, 0.2f), List.of(0.3f, 0.4f));
    verify(meterRegistry.counter("embedding.requests.success", "type", "passage")).increment();
  }

  @Test
  @DisplayName("Should not call the model for an empty batch")
  void shouldSkipModel_whenNoPassages() {
    assertThat(embeddingService.embedPassages(List.of())).isEmpty();
    verifyNoInteractions(embeddingModel);
  }

  @Test
  @DisplayName("Should truncate passages that are too long to embed")
  @SuppressWarnings("unchecked")
  void shouldTruncateLongPassages() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {1f}))));

    embeddingService.embedPassages(List.of("x".repeat(10_000)));

    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(captor.capture());
    assertThat(captor.getValue().get(0).text()).hasSize(6000);
  }

  @Test
  @DisplayName("Should report the backend as unavailable when the model call fails")
  void shouldThrowUnavailable_whenModelFails() {
    when(embeddingModel.embedAll(anyList())).thenThrow(new RuntimeException("connection refused"));

    assertThatThrownBy(() -> embeddingService.embedPassages(List.of("text")))
        .isInstanceOf(EmbeddingServiceUnavailableException.class)
        .hasMessageContaining("connection refused");
  }

  @Test
  @DisplayName("Should report the backend as unavailable when vector count mismatches")
  void shouldThrowUnavailable_whenVectorCountMismatches() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {1f}))));

    assertThatThrownBy(() -> embeddingService.embedPassages(List.of("a", "b")))
        .isInstanceOf(EmbeddingServiceUnavailableException.class)
        .hasMessageContaining("1 vectors for 2 passages");
  }
}
