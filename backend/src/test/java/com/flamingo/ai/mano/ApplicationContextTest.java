package com.flamingo.ai.mano;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.mano.cache.ContextCache;
import com.flamingo.ai.mano.service.chat.ChatService;
import com.flamingo.ai.mano.service.context.ManagementContextService;
import com.flamingo.ai.mano.service.detection.PersonMentionDetector;
import com.flamingo.ai.mano.service.insight.ProactiveInsightService;
import com.flamingo.ai.mano.service.learning.LearningService;
import com.flamingo.ai.mano.service.search.SemanticMemorySearchService;
import com.flamingo.ai.mano.service.task.EmbeddingBackfillService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads with the language models and Elasticsearch
 * replaced by mocks.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean(name = "chatModel")
  private ChatModel chatModel;

  @MockitoBean(name = "textChatModel")
  private ChatModel textChatModel;

  @MockitoBean private StreamingChatModel streamingChatModel;
  @MockitoBean private EmbeddingModel embeddingModel;
  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All engine beans should be available")
  void engineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ContextCache.class)).isNotNull();
    assertThat(applicationContext.getBean(ManagementContextService.class)).isNotNull();
    assertThat(applicationContext.getBean(SemanticMemorySearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(PersonMentionDetector.class)).isNotNull();
    assertThat(applicationContext.getBean(LearningService.class)).isNotNull();
    assertThat(applicationContext.getBean(ProactiveInsightService.class)).isNotNull();
    assertThat(applicationContext.getBean(EmbeddingBackfillService.class)).isNotNull();
    assertThat(applicationContext.getBean(ChatService.class)).isNotNull();
  }
}
