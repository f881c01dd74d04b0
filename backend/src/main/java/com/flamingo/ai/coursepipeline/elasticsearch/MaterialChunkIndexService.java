package com.flamingo.ai.coursepipeline.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.coursepipeline.exception.VectorStoreWriteException;
import com.flamingo.ai.coursepipeline.service.embedding.VectorStore;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed {@link VectorStore} for material chunks.
 *
 * <p>All courses share one index; the {@code collectionId} keyword field scopes queries to a
 * course.
 */
@Service
@Slf4j
public class MaterialChunkIndexService extends AbstractElasticsearchIndexService<MaterialChunk>
    implements VectorStore {

  static final String COLLECTION_ID = "collectionId";
  static final String COURSE_ID = "courseId";
  static final String CHAPTER_ID = "chapterId";
  static final String MATERIAL_ID = "materialId";

  @Value("${elasticsearch.index.name:course-material-chunks}")
  private String indexName;

  @Value("${elasticsearch.index.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public MaterialChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public MaterialChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // ID fields must be keyword for exact term matching
    properties.put(COLLECTION_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(COURSE_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(CHAPTER_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(MATERIAL_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("startChar", Property.of(p -> p.integer(i -> i)));
    properties.put("endChar", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(MaterialChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(COLLECTION_ID, chunk.getCollectionId());
    document.put(COURSE_ID, chunk.getCourseId().toString());
    document.put(CHAPTER_ID, chunk.getChapterId().toString());
    document.put(MATERIAL_ID, chunk.getMaterialId().toString());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("startChar", chunk.getStartChar());
    document.put("endChar", chunk.getEndChar());
    document.put("content", chunk.getContent());
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected MaterialChunk convertFromDocument(Map<String, Object> source) {
    return MaterialChunk.builder()
        .id((String) source.get("id"))
        .collectionId((String) source.get(COLLECTION_ID))
        .courseId(UUID.fromString((String) source.get(COURSE_ID)))
        .chapterId(UUID.fromString((String) source.get(CHAPTER_ID)))
        .materialId(UUID.fromString((String) source.get(MATERIAL_ID)))
        .chunkIndex(asInt(source.get("chunkIndex")))
        .startChar(asInt(source.get("startChar")))
        .endChar(asInt(source.get("endChar")))
        .content((String) source.get("content"))
        .embedding(toFloatList((List<Number>) source.get("embedding")))
        .build();
  }

  @Override
  protected String getDocumentId(MaterialChunk entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    String collectionId = (String) filterCriteria.get(COLLECTION_ID);
    if (collectionId == null) {
      throw new IllegalArgumentException("collectionId filter is required for vector search");
    }
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(Math.max(topK * 2, 10))
                            .filter(f -> f.term(t -> t.field(COLLECTION_ID).value(collectionId))))
                .size(topK));
  }

  @Override
  protected Query buildCriteriaQuery(Map<String, Object> criteria) {
    for (String field : List.of(MATERIAL_ID, CHAPTER_ID, COURSE_ID, COLLECTION_ID)) {
      Object value = criteria.get(field);
      if (value != null) {
        return Query.of(q -> q.term(t -> t.field(field).value(value.toString())));
      }
    }
    throw new IllegalArgumentException(
        "Criteria must contain one of materialId, chapterId, courseId or collectionId");
  }

  @Override
  protected String getMetricPrefix() {
    return "material_chunk";
  }

  // VectorStore

  @Override
  @CircuitBreaker(name = "vectorStore", fallbackMethod = "writeFallback")
  public void upsert(String collectionId, List<MaterialChunk> chunks) {
    for (MaterialChunk chunk : chunks) {
      chunk.setCollectionId(collectionId);
      if (chunk.getId() == null) {
        chunk.setId(MaterialChunk.chunkId(chunk.getMaterialId(), chunk.getChunkIndex()));
      }
    }
    indexDocuments(chunks);
    refresh();
  }

  @Override
  @CircuitBreaker(name = "vectorStore", fallbackMethod = "deleteFallback")
  public void deleteByMaterial(UUID materialId) {
    deleteBy(Map.of(MATERIAL_ID, materialId));
  }

  @Override
  @CircuitBreaker(name = "vectorStore", fallbackMethod = "queryFallback")
  public List<MaterialChunk> query(String collectionId, List<Float> queryVector, int k) {
    return vectorSearch(Map.of(COLLECTION_ID, collectionId), queryVector, k);
  }

  @Override
  public long countByMaterial(UUID materialId) {
    return countBy(Map.of(MATERIAL_ID, materialId));
  }

  @SuppressWarnings("unused")
  private void writeFallback(String collectionId, List<MaterialChunk> chunks, Throwable t) {
    throw asWriteFailure("upsert into " + collectionId, t);
  }

  @SuppressWarnings("unused")
  private void deleteFallback(UUID id, Throwable t) {
    throw asWriteFailure("delete chunks of " + id, t);
  }

  @SuppressWarnings("unused")
  private List<MaterialChunk> queryFallback(
      String collectionId, List<Float> queryVector, int k, Throwable t) {
    log.warn("Vector query fallback for {}: {}", collectionId, t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  private VectorStoreWriteException asWriteFailure(String operation, Throwable t) {
    if (t instanceof VectorStoreWriteException e) {
      return e;
    }
    log.warn("Vector store unavailable for {}: {}", operation, t.getMessage());
    return new VectorStoreWriteException("Vector store unavailable for " + operation, t);
  }

  private static int asInt(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  private static List<Float> toFloatList(List<Number> values) {
    if (values == null) {
      return List.of();
    }
    List<Float> result = new ArrayList<>(values.size());
    for (Number value : values) {
      result.add(value.floatValue());
    }
    return result;
  }
}
