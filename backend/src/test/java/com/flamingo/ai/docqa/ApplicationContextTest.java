package com.flamingo.ai.docqa;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docqa.domain.enums.DocumentState;
import com.flamingo.ai.docqa.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.docqa.service.qa.DocumentQaService;
import com.flamingo.ai.docqa.service.rag.capability.ModelCapability;
import com.flamingo.ai.docqa.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.docqa.service.rag.retrieval.Retriever;
import com.flamingo.ai.docqa.service.rag.synthesis.AnswerSynthesizer;
import com.flamingo.ai.docqa.service.state.DocumentStateManager;
import com.flamingo.ai.docqa.service.storage.DocumentStorageService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The OpenAI models are mocked so the test runs
 * without network access or an API key.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DocumentQaService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentIngestionService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentStorageService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentChunker.class)).isNotNull();
    assertThat(applicationContext.getBean(Retriever.class)).isNotNull();
    assertThat(applicationContext.getBean(AnswerSynthesizer.class)).isNotNull();
    assertThat(applicationContext.getBean(ModelCapability.class).embeddingModelId())
        .isEqualTo("text-embedding-3-small");
  }

  @Test
  @DisplayName("Should start with no active document")
  void shouldStartEmpty() {
    assertThat(applicationContext.getBean(DocumentStateManager.class).state())
        .isEqualTo(DocumentState.EMPTY);
  }
}
