package com.flamingo.ai.docqa.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.exception.EmptyInputException;
import com.flamingo.ai.docqa.exception.IncompatibleIndexException;
import com.flamingo.ai.docqa.exception.NoActiveDocumentException;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docqa.service.rag.index.DocumentIndex;
import com.flamingo.ai.docqa.service.rag.model.IndexedChunk;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.rag.model.TextChunk;
import com.flamingo.ai.docqa.service.state.DocumentStateManager;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("Retriever Tests")
class RetrieverTest {

  private static final String MODEL = "test-model";

  @Mock private EmbeddingService embeddingService;

  private DocumentStateManager stateManager;
  private RagConfig ragConfig;
  private Retriever retriever;

  @BeforeEach
  void setUp() {
    stateManager = new DocumentStateManager();
    ragConfig = new RagConfig();
    retriever = new Retriever(stateManager, embeddingService, ragConfig);
    when(embeddingService.modelId()).thenReturn(MODEL);
  }

  @Test
  void shouldThrowNoActiveDocument_withoutCallingCapability_whenNothingUploaded() {
    assertThatThrownBy(() -> retriever.retrieve("What color is the sky?", 4))
        .isInstanceOf(NoActiveDocumentException.class);

    verifyNoInteractions(embeddingService);
  }

  @Test
  void shouldRetrieveFromPublishedDocument() {
    // Given
    publish(index(MODEL, new float[] {1, 0}, new float[] {0, 1}, new float[] {1, 1}));
    when(embeddingService.embedQuery("question")).thenReturn(new float[] {0, 1});

    // When
    List<ScoredChunk> results = retriever.retrieve("question", 2);

    // Then
    assertThat(results).extracting(r -> r.chunk().sequenceIndex()).containsExactly(1, 2);
    assertThat(results).allSatisfy(r -> assertThat(r.score()).isBetween(0.0, 1.0));
  }

  @Test
  void shouldRefuseIndexBuiltWithAnotherModel() {
    // Given
    DocumentIndex index = index("old-model", new float[] {1, 0});

    // When / Then
    assertThatThrownBy(() -> retriever.retrieve(index, "question", 4))
        .isInstanceOf(IncompatibleIndexException.class)
        .hasMessageContaining("old-model");
    verify(embeddingService, never()).embedQuery(anyString());
  }

  @Test
  void shouldClampKToConfiguredRange() {
    // Given
    ragConfig.getRetrieval().setMaxTopK(3);
    DocumentIndex index =
        index(
            MODEL,
            new float[] {1, 0},
            new float[] {1, 0.1f},
            new float[] {1, 0.2f},
            new float[] {1, 0.3f},
            new float[] {1, 0.4f});
    when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {1, 0});

    // When / Then
    assertThat(retriever.retrieve(index, "question", 0)).hasSize(1);
    assertThat(retriever.retrieve(index, "question", -7)).hasSize(1);
    assertThat(retriever.retrieve(index, "question", 100)).hasSize(3);
  }

  @Test
  void shouldDropChunksWithoutPositiveSimilarity() {
    // Given
    DocumentIndex index = index(MODEL, new float[] {1, 0}, new float[] {-1, 0});
    when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {0, 1});

    // When
    List<ScoredChunk> results = retriever.retrieve(index, "unrelated question", 4);

    // Then
    assertThat(results).isEmpty();
  }

  @Test
  void shouldRejectBlankQuestion() {
    DocumentIndex index = index(MODEL, new float[] {1, 0});

    assertThatThrownBy(() -> retriever.retrieve(index, "  ", 4))
        .isInstanceOf(EmptyInputException.class);
    verify(embeddingService, never()).embedQuery(anyString());
  }

  private void publish(DocumentIndex index) {
    Document document =
        Document.builder().id(index.documentId()).fileName("doc.pdf").content("text").build();
    stateManager.publish(stateManager.beginBuild(), document, index);
  }

  private static DocumentIndex index(String model, float[]... vectors) {
    UUID documentId = UUID.randomUUID();
    List<IndexedChunk> entries = new ArrayList<>();
    for (int i = 0; i < vectors.length; i++) {
      TextChunk chunk = new TextChunk(documentId, i, "chunk " + i, i * 10, 0);
      entries.add(new IndexedChunk(chunk, vectors[i]));
    }
    return new DocumentIndex(documentId, model, entries, Instant.now());
  }
}
