package com.flamingo.ai.mano.service.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.mano.config.EngineConfig;
import com.flamingo.ai.mano.domain.entity.ChatMessage;
import com.flamingo.ai.mano.domain.enums.MessageRole;
import com.flamingo.ai.mano.domain.repository.ChatMessageRepository;
import com.flamingo.ai.mano.exception.SearchException;
import com.flamingo.ai.mano.service.search.VectorSearchService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EmbeddingBackfillServiceTest {

  private static final String USER_ID = "user-1";

  @Mock private ChatMessageRepository chatMessageRepository;
  @Mock private VectorSearchService vectorSearchService;

  private SimpleMeterRegistry meterRegistry;
  private EmbeddingBackfillService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    EngineConfig config = new EngineConfig();
    config.getBackfill().setBatchSize(2);
    config.getBackfill().setBatchDelay(Duration.ZERO);
    config.getBackfill().setMaxMessagesPerRun(10);
    service =
        new EmbeddingBackfillService(
            chatMessageRepository,
            vectorSearchService,
            new BackgroundTaskDispatcher(new SyncTaskExecutor(), meterRegistry),
            config,
            meterRegistry);
  }

  private static List<ChatMessage> messages(int count) {
    return IntStream.range(0, count)
        .mapToObj(
            i ->
                ChatMessage.builder()
                    .id(UUID.randomUUID())
                    .userId(USER_ID)
                    .role(MessageRole.USER)
                    .content("message " + i)
                    .build())
        .collect(Collectors.toList());
  }

  private static List<UUID> ids(List<ChatMessage> batch) {
    return batch.stream().map(ChatMessage::getId).collect(Collectors.toList());
  }

  @Test
  @DisplayName("should index pending messages in batches and mark them embedded")
  void shouldIndexInBatches() {
    List<ChatMessage> pending = messages(5);
    when(chatMessageRepository.findUnembedded(eq(USER_ID), any(Pageable.class)))
        .thenReturn(pending);
    when(vectorSearchService.index(anyList()))
        .thenAnswer(invocation -> ids(invocation.getArgument(0)));

    EmbeddingBackfillService.BackfillResult result = service.backfill(USER_ID);

    assertThat(result).isEqualTo(new EmbeddingBackfillService.BackfillResult(5, 0));
    verify(vectorSearchService, times(3)).index(anyList());
    verify(chatMessageRepository, times(3)).markEmbedded(anyList());
    assertThat(
            meterRegistry
                .counter("embedding.backfill.messages", "outcome", "indexed")
                .count())
        .isEqualTo(5.0);
  }

  @Test
  @DisplayName("should retry a failed batch message by message so good messages are still marked")
  void shouldIsolateFailingMessage() {
    List<ChatMessage> pending = messages(4);
    ChatMessage failing = pending.get(1);
    when(chatMessageRepository.findUnembedded(eq(USER_ID), any(Pageable.class)))
        .thenReturn(pending);
    when(vectorSearchService.index(anyList()))
        .thenAnswer(
            invocation -> {
              List<ChatMessage> batch = invocation.getArgument(0);
              if (batch.contains(failing)) {
                throw new SearchException("embedding rejected");
              }
              return ids(batch);
            });

    EmbeddingBackfillService.BackfillResult result = service.backfill(USER_ID);

    assertThat(result).isEqualTo(new EmbeddingBackfillService.BackfillResult(3, 1));
    verify(chatMessageRepository).markEmbedded(List.of(pending.get(0).getId()));
    verify(chatMessageRepository).markEmbedded(ids(pending.subList(2, 4)));
    verify(chatMessageRepository, never())
        .markEmbedded(argThat(marked -> marked.contains(failing.getId())));
    assertThat(
            meterRegistry.counter("embedding.backfill.messages", "outcome", "failed").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should mark blank messages without embedding them")
  void shouldSkipBlankMessages() {
    List<ChatMessage> pending = messages(2);
    ChatMessage blank =
        ChatMessage.builder()
            .id(UUID.randomUUID())
            .userId(USER_ID)
            .role(MessageRole.ASSISTANT)
            .content("  ")
            .build();
    pending.add(0, blank);
    when(chatMessageRepository.findUnembedded(eq(USER_ID), any(Pageable.class)))
        .thenReturn(pending);
    when(vectorSearchService.index(anyList()))
        .thenAnswer(invocation -> ids(invocation.getArgument(0)));

    EmbeddingBackfillService.BackfillResult result = service.backfill(USER_ID);

    assertThat(result).isEqualTo(new EmbeddingBackfillService.BackfillResult(2, 0));
    verify(chatMessageRepository).markEmbedded(List.of(blank.getId()));
    verify(vectorSearchService, never()).index(argThat(batch -> batch.contains(blank)));
  }

  @Test
  @DisplayName("should do nothing when every message is already embedded")
  void shouldSkipWhenNothingPending() {
    when(chatMessageRepository.findUnembedded(eq(USER_ID), any(Pageable.class)))
        .thenReturn(List.of());

    EmbeddingBackfillService.BackfillResult result = service.backfill(USER_ID);

    assertThat(result.processed()).isZero();
    verify(vectorSearchService, never()).index(anyList());
  }

  @Test
  @DisplayName("should run scheduled backfills through the background dispatcher")
  void shouldScheduleThroughDispatcher() {
    when(chatMessageRepository.findUnembedded(eq(USER_ID), any(Pageable.class)))
        .thenReturn(List.of());

    boolean accepted = service.scheduleBackfill(USER_ID);

    assertThat(accepted).isTrue();
    assertThat(
            meterRegistry
                .counter("background.tasks", "task", "embedding-backfill", "outcome", "success")
                .count())
        .isEqualTo(1.0);
  }
}
