package com.flamingo.ai.coursepipeline.service.embedding;

import com.flamingo.ai.coursepipeline.exception.EmbeddingServiceUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Computes text embeddings with the configured LangChain4j {@link EmbeddingModel}.
 *
 * <p>Any backend failure, including an open circuit, is reported as {@link
 * EmbeddingServiceUnavailableException}; retries are left to the job queue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense scripts
  private static final int MAX_CHARS_PER_EMBEDDING = 6000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a batch of passages in one call.
   *
   * @param passages chunk texts
   * @return one vector per passage, in input order
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed a batch of chunks")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedPassagesFallback")
  public List<List<Float>> embedPassages(List<String> passages) {
    if (passages.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = new ArrayList<>(passages.size());
    for (int i = 0; i < passages.size(); i++) {
      segments.add(TextSegment.from(truncate(passages.get(i), i)));
    }

    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
      throw new EmbeddingServiceUnavailableException(
          "Embedding backend call failed: " + e.getMessage(), e);
    }

    List<Embedding> embeddings = response.content();
    if (embeddings == null || embeddings.size() != passages.size()) {
      meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
      throw new EmbeddingServiceUnavailableException(
          "Embedding backend returned "
              + (embeddings == null ? 0 : embeddings.size())
              + " vectors for "
              + passages.size()
              + " passages");
    }

    List<List<Float>> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      vectors.add(toFloatList(embedding.vector()));
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    log.debug("Embedded {} passages", passages.size());
    return vectors;
  }

  private String truncate(String text, int index) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Passage {} too long for embedding, truncating from {} chars to {} chars",
        index,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedPassagesFallback(List<String> passages, Throwable t) {
    throw unavailable(t);
  }

  private EmbeddingServiceUnavailableException unavailable(Throwable t) {
    if (t instanceof EmbeddingServiceUnavailableException e) {
      return e;
    }
    log.error("Embedding call rejected, circuit breaker open: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "circuit_open").increment();
    return new EmbeddingServiceUnavailableException("Embedding service unavailable", t);
  }
}
