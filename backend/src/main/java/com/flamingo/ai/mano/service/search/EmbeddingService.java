package com.flamingo.ai.mano.service.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates embeddings for queries and conversation messages. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // Coaching messages are short; anything longer is truncated well below the model limit.
  private static final int MAX_CHARS_PER_EMBEDDING = 8000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextFallback")
  @Retry(name = "openai")
  public List<Float> embedText(String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text));
      meterRegistry.counter("embedding.requests.success").increment();
      return toList(response.content().vector());
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /** Embeds several texts in one request. The result keeps the input order. */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextsFallback")
  @Retry(name = "openai")
  public List<List<Float>> embedTexts(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments = texts.stream().map(t -> TextSegment.from(truncate(t))).toList();
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<List<Float>> results = new ArrayList<>(segments.size());
      for (Embedding embedding : response.content()) {
        results.add(toList(embedding.vector()));
      }
      meterRegistry.counter("embedding.requests.success").increment(texts.size());
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  @SuppressWarnings("unused")
  private List<Float> embedTextFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker open: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedTextsFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment(texts.size());
    return List.of();
  }

  private String truncate(String text) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn("Text too long for embedding, truncating from {} chars", text.length());
      return text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    return text;
  }

  private List<Float> toList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
