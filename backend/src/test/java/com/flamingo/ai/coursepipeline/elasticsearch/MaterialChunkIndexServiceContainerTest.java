package com.flamingo.ai.coursepipeline.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.flamingo.ai.coursepipeline.service.embedding.VectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the chunk index against a real Elasticsearch node. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("MaterialChunkIndexService Container Test")
class MaterialChunkIndexServiceContainerTest {

  @Container
  private static final ElasticsearchContainer ELASTICSEARCH_CONTAINER =
      new ElasticsearchContainer("docker.elastic.co/elasticsearch/elasticsearch:9.1.0")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("xpack.security.http.ssl.enabled", "false")
          .withStartupTimeout(Duration.ofMinutes(2));

  private Rest5Client restClient;
  private MaterialChunkIndexService indexService;
  private UUID courseA;
  private UUID courseB;

  @BeforeEach
  void setUp() {
    restClient =
        Rest5Client.builder(
                new HttpHost(
                    "http",
                    ELASTICSEARCH_CONTAINER.getHost(),
                    ELASTICSEARCH_CONTAINER.getMappedPort(9200)))
            .build();
    ElasticsearchClient client =
        new ElasticsearchClient(new Rest5ClientTransport(restClient, new JacksonJsonpMapper()));
    indexService =
        new MaterialChunkIndexService(
            client, new SimpleMeterRegistry(), "chunks-" + UUID.randomUUID(), 3);
    indexService.initIndex();
    courseA = UUID.randomUUID();
    courseB = UUID.randomUUID();
  }

  @AfterEach
  void tearDown() throws IOException {
    restClient.close();
  }

  private List<MaterialChunk> chunks(UUID courseId, UUID materialId, int count, float[] vector) {
    List<MaterialChunk> chunks = new ArrayList<>();
    UUID chapterId = UUID.randomUUID();
    for (int i = 0; i < count; i++) {
      chunks.add(
          MaterialChunk.builder()
              .id(MaterialChunk.chunkId(materialId, i))
              .courseId(courseId)
              .chapterId(chapterId)
              .materialId(materialId)
              .chunkIndex(i)
              .content("chunk " + i + " of " + materialId)
              .startChar(i * 600)
              .endChar(i * 600 + 700)
              .embedding(List.of(vector[0], vector[1], vector[2]))
              .build());
    }
    return chunks;
  }

  @Test
  @DisplayName("Should scope vector queries to the course collection")
  void shouldScopeQueriesToCollection() {
    UUID materialA = UUID.randomUUID();
    UUID materialB = UUID.randomUUID();
    indexService.upsert(
        VectorStore.collectionIdFor(courseA),
        chunks(courseA, materialA, 3, new float[] {1f, 0f, 0f}));
    indexService.upsert(
        VectorStore.collectionIdFor(courseB),
        chunks(courseB, materialB, 2, new float[] {1f, 0f, 0f}));

    List<MaterialChunk> results =
        indexService.query(VectorStore.collectionIdFor(courseA), List.of(1f, 0f, 0f), 10);

    assertThat(results).hasSize(3);
    assertThat(results).allSatisfy(c -> assertThat(c.getMaterialId()).isEqualTo(materialA));
    assertThat(indexService.countByMaterial(materialB)).isEqualTo(2);
  }

  @Test
  @DisplayName("Should overwrite chunks with the same id and delete by material")
  void shouldOverwriteAndDelete() {
    UUID material = UUID.randomUUID();
    String collection = VectorStore.collectionIdFor(courseA);
    indexService.upsert(collection, chunks(courseA, material, 2, new float[] {0f, 1f, 0f}));
    indexService.upsert(collection, chunks(courseA, material, 2, new float[] {0f, 1f, 0f}));

    assertThat(indexService.countByMaterial(material)).isEqualTo(2);

    indexService.deleteByMaterial(material);
    indexService.refresh();

    assertThat(indexService.countByMaterial(material)).isZero();
  }
}
