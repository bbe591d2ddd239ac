package com.flamingo.ai.mano.service.task;

import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.repository.ChatMessageRepository;
import com.flamingo.ai.mano.exception.SearchException;
import com.flamingo.ai.mano.service.search.VectorSearchService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

/**
 * Embeds and indexes messages that were saved without an embedding. Each run handles a bounded
 * number of messages in small batches with a pause between batches. Blank messages are marked
 * without being embedded, and a failing batch is retried message by message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingBackfillService {

  private final ChatMessageRepository chatMessageRepository;
  private final VectorSearchService vectorSearchService;
  private final BackgroundTaskDispatcher taskDispatcher;
  private final EngineConfig engineConfig;
  private final MeterRegistry meterRegistry;

  /** Outcome of one backfill run. */
  public record BackfillResult(int processed, int failed) {}

  /** Queues a backfill run for the user. */
  public boolean scheduleBackfill(String userId) {
    return taskDispatcher.submit("embedding-backfill", () -> backfill(userId));
  }

  /** Embeds up to the configured number of unembedded messages of a user. */
  public BackfillResult backfill(String userId) {
    EngineConfig.Backfill config = engineConfig.getBackfill();
    List<ChatMessage> pending =
        chatMessageRepository.findUnembedded(
            userId, Pageable.ofSize(config.getMaxMessagesPerRun()));
    if (pending.isEmpty()) {
      log.debug("No messages to backfill for user {}", userId);
      return new BackfillResult(0, 0);
    }
    List<ChatMessage> blank =
        pending.stream().filter(message -> isBlank(message.getContent())).toList();
    if (!blank.isEmpty()) {
      chatMessageRepository.markEmbedded(blank.stream().map(ChatMessage::getId).toList());
      meterRegistry
          .counter("embedding.backfill.messages", "outcome", "skipped")
          .increment(blank.size());
      log.debug("Skipped {} blank messages of user {}", blank.size(), userId);
    }
    List<ChatMessage> embeddable =
        pending.stream().filter(message -> !isBlank(message.getContent())).toList();
    log.info("Backfilling embeddings for {} messages of user {}", embeddable.size(), userId);

    int processed = 0;
    int failed = 0;
    for (int start = 0; start < embeddable.size(); start += config.getBatchSize()) {
      if (start > 0 && !pause(config.getBatchDelay())) {
        log.warn("Backfill for user {} interrupted after {} messages", userId, processed);
        break;
      }
      List<ChatMessage> batch =
          embeddable.subList(start, Math.min(start + config.getBatchSize(), embeddable.size()));
      int indexed = indexBatch(batch);
      processed += indexed;
      failed += batch.size() - indexed;
    }

    meterRegistry.counter("embedding.backfill.messages", "outcome", "indexed").increment(processed);
    meterRegistry.counter("embedding.backfill.messages", "outcome", "failed").increment(failed);
    log.info("Backfill for user {} done: {} indexed, {} failed", userId, processed, failed);
    return new BackfillResult(processed, failed);
  }

  /** Indexes a batch, retrying its messages one by one when the batch as a whole fails. */
  private int indexBatch(List<ChatMessage> batch) {
    try {
      List<UUID> indexed = vectorSearchService.index(batch);
      if (!indexed.isEmpty()) {
        chatMessageRepository.markEmbedded(indexed);
      }
      return indexed.size();
    } catch (SearchException e) {
      if (batch.size() == 1) {
        log.warn("Message {} could not be indexed: {}", batch.get(0).getId(), e.getMessage());
        return 0;
      }
      log.warn(
          "Backfill batch of {} messages failed, retrying one by one: {}",
          batch.size(),
          e.getMessage());
    }
    int indexed = 0;
    for (ChatMessage message : batch) {
      indexed += indexBatch(List.of(message));
    }
    return indexed;
  }

  private static boolean isBlank(String content) {
    return content == null || content.isBlank();
  }

  private boolean pause(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
