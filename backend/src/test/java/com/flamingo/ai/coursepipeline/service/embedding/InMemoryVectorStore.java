package com.flamingo.ai.coursepipeline.service.embedding;

import com.flamingo.ai.coursepipeline.elasticsearch.MaterialChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** {@link VectorStore} kept in a map, for tests that should not need Elasticsearch. */
public class InMemoryVectorStore implements VectorStore {

  private final Map<String, MaterialChunk> chunks = new ConcurrentHashMap<>();

  @Override
  public void upsert(String collectionId, List<MaterialChunk> batch) {
    for (MaterialChunk chunk : batch) {
      chunk.setCollectionId(collectionId);
      chunks.put(chunk.getId(), chunk);
    }
  }

  @Override
  public void deleteByMaterial(UUID materialId) {
    chunks.values().removeIf(c -> materialId.equals(c.getMaterialId()));
  }

  @Override
  public List<MaterialChunk> query(String collectionId, List<Float> queryVector, int k) {
    return chunks.values().stream()
        .filter(c -> collectionId.equals(c.getCollectionId()))
        .sorted(Comparator.comparingDouble(c -> -dot(c.getEmbedding(), queryVector)))
        .limit(k)
        .toList();
  }

  @Override
  public long countByMaterial(UUID materialId) {
    return chunks.values().stream().filter(c -> materialId.equals(c.getMaterialId())).count();
  }

  public List<MaterialChunk> chunksOf(UUID materialId) {
    return new ArrayList<>(
        chunks.values().stream()
            .filter(c -> materialId.equals(c.getMaterialId()))
            .sorted(Comparator.comparingInt(MaterialChunk::getChunkIndex))
            .toList());
  }

  public int size() {
    return chunks.size();
  }

  public void clear() {
    chunks.clear();
  }

  private static double dot(List<Float> a, List<Float> b) {
    double sum = 0;
    for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
      sum += a.get(i) * b.get(i);
    }
    return sum;
  }
}
