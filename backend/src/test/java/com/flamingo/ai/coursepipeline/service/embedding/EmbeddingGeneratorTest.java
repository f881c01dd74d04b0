package com.flamingo.ai.coursepipeline.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.flamingo.ai.coursepipeline.config.PipelineConfig;
import com.flamingo.ai.coursepipeline.elasticsearch.MaterialChunk;
import com.flamingo.ai.coursepipeline.exception.EmbeddingServiceUnavailableException;
import com.flamingo.ai.coursepipeline.exception.MaterialProcessingException;
import com.flamingo.ai.coursepipeline.service.chunking.SlidingWindowChunker;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingGenerator Tests")
class EmbeddingGeneratorTest {

  @Mock private EmbeddingService embeddingService;

  private InMemoryVectorStore vectorStore;
  private EmbeddingGenerator generator;
  private UUID courseId;
  private UUID chapterId;
  private UUID materialId;

  @BeforeEach
  void setUp() {
    vectorStore = new InMemoryVectorStore();
    generator =
        new EmbeddingGenerator(
            new SlidingWindowChunker(new PipelineConfig()), embeddingService, vectorStore);
    courseId = UUID.randomUUID();
    chapterId = UUID.randomUUID();
    materialId = UUID.randomUUID();
  }

  @Test
  @DisplayName("Should store one chunk per window in the course collection")
  void shouldStoreChunks() {
    when(embeddingService.embedPassages(anyList())).thenAnswer(inv -> vectors(inv.getArgument(0)));

    EmbeddingResult result = generate("z".repeat(1500));

    assertThat(result.chunksAdded()).isEqualTo(3);
    assertThat(result.collectionId()).isEqualTo("course_" + courseId);
    List<MaterialChunk> stored = vectorStore.chunksOf(materialId);
    assertThat(stored).extracting(MaterialChunk::getChunkIndex).containsExactly(0, 1, 2);
    assertThat(stored)
        .allSatisfy(
            chunk -> {
              assertThat(chunk.getCollectionId()).isEqualTo("course_" + courseId);
              assertThat(chunk.getChapterId()).isEqualTo(chapterId);
              assertThat(chunk.getId()).startsWith(materialId + "_");
            });
  }

  @Test
  @DisplayName("Should replace the previous chunk set of the material")
  void shouldReplacePreviousChunks() {
    when(embeddingService.embedPassages(anyList())).thenAnswer(inv -> vectors(inv.getArgument(0)));
    generate("z".repeat(2000));
    assertThat(vectorStore.countByMaterial(materialId)).isEqualTo(4);

    generate("short replacement text");

    assertThat(vectorStore.chunksOf(materialId))
        .singleElement()
        .extracting(MaterialChunk::getContent)
        .isEqualTo("short replacement text");
  }

  @Test
  @DisplayName("Should keep existing chunks when embedding fails")
  void shouldKeepExistingChunks_whenEmbeddingFails() {
    when(embeddingService.embedPassages(anyList()))
        .thenAnswer(inv -> vectors(inv.getArgument(0)))
        .thenThrow(new EmbeddingServiceUnavailableException("down"));
    generate("first version of the material");

    assertThatThrownBy(
            () -> generate("second version"))
        .isInstanceOf(EmbeddingServiceUnavailableException.class);

    assertThat(vectorStore.chunksOf(materialId))
        .singleElement()
        .extracting(MaterialChunk::getContent)
        .isEqualTo("first version of the material");
  }

  @Test
  @DisplayName("Should not overwrite chunks with text that was superseded during embedding")
  void shouldKeepChunks_whenTextSuperseded() {
    when(embeddingService.embedPassages(anyList())).thenAnswer(inv -> vectors(inv.getArgument(0)));
    generate("current version of the material");

    assertThatThrownBy(
            () -> generator.generate(courseId, chapterId, materialId, "older version", () -> false))
        .isInstanceOf(MaterialProcessingException.class)
        .hasMessageContaining("changed while it was being embedded");

    assertThat(vectorStore.chunksOf(materialId))
        .singleElement()
        .extracting(MaterialChunk::getContent)
        .isEqualTo("current version of the material");
  }

  @Test
  @DisplayName("Should leave the material without chunks for blank text")
  void shouldStoreNothing_whenTextBlank() {
    when(embeddingService.embedPassages(anyList())).thenReturn(List.of());

    EmbeddingResult result = generate("   ");

    assertThat(result.chunksAdded()).isZero();
    assertThat(vectorStore.size()).isZero();
  }

  @Test
  @DisplayName("Should remove all chunks of a material")
  void shouldRemoveMaterial() {
    when(embeddingService.embedPassages(anyList())).thenAnswer(inv -> vectors(inv.getArgument(0)));
    generate("content to remove later");

    generator.removeMaterial(materialId);

    assertThat(vectorStore.countByMaterial(materialId)).isZero();
  }

  private EmbeddingResult generate(String text) {
    return generator.generate(courseId, chapterId, materialId, text, () -> true);
  }

  private static List<List<Float>> vectors(List<String> passages) {
    return Collections.nCopies(passages.size(), List.of(0.1f, 0.2f, 0.3f));
  }
}
