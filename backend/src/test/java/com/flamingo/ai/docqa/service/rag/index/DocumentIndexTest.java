package com.flamingo.ai.docqa.service.rag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.docqa.exception.IncompatibleIndexException;
import com.flamingo.ai.docqa.service.rag.model.IndexedChunk;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.rag.model.TextChunk;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentIndex Tests")
class DocumentIndexTest {

  private final UUID documentId = UUID.randomUUID();

  @Test
  @DisplayName("should order by descending similarity and break ties by sequence index")
  void shouldOrderBySimilarityThenSequence() {
    // Given
    DocumentIndex index =
        index(
            new float[] {1, 0},
            new float[] {0, 1},
            new float[] {1, 0},
            new float[] {1, 1});

    // When
    List<ScoredChunk> results = index.search(new float[] {1, 0}, 3);

    // Then
    assertThat(results).extracting(r -> r.chunk().sequenceIndex()).containsExactly(0, 2, 3);
    assertThat(results.get(0).score()).isCloseTo(1.0, within(1e-9));
    assertThat(results.get(1).score()).isCloseTo(1.0, within(1e-9));
    assertThat(results.get(2).score()).isCloseTo(Math.sqrt(0.5), within(1e-6));
  }

  @Test
  @DisplayName("should report negative similarity as zero score")
  void shouldClampNegativeSimilarityToZero() {
    DocumentIndex index = index(new float[] {-1, 0}, new float[] {0, 1});

    List<ScoredChunk> results = index.search(new float[] {1, 0}, 2);

    // cosine 0 ranks above cosine -1 even though both report score 0
    assertThat(results).extracting(r -> r.chunk().sequenceIndex()).containsExactly(1, 0);
    assertThat(results).allSatisfy(r -> assertThat(r.score()).isZero());
  }

  @Test
  @DisplayName("should return every chunk when k exceeds the index size")
  void shouldReturnAllChunks_whenKExceedsSize() {
    DocumentIndex index = index(new float[] {1, 0}, new float[] {0, 1});

    assertThat(index.search(new float[] {1, 1}, 10)).hasSize(2);
    assertThat(index.search(new float[] {1, 1}, 0)).isEmpty();
  }

  @Test
  @DisplayName("should reject a query vector of another dimension")
  void shouldThrowIncompatibleIndex_whenDimensionDiffers() {
    DocumentIndex index = index(new float[] {1, 0, 0});

    assertThatThrownBy(() -> index.search(new float[] {1, 0}, 1))
        .isInstanceOf(IncompatibleIndexException.class)
        .hasMessageContaining("dimension 2");
  }

  @Test
  @DisplayName("should reject chunks with inconsistent dimensions or foreign documents")
  void shouldRejectInconsistentEntries() {
    TextChunk first = new TextChunk(documentId, 0, "a", 0, 0);
    TextChunk second = new TextChunk(documentId, 1, "b", 1, 0);
    TextChunk foreign = new TextChunk(UUID.randomUUID(), 1, "c", 2, 0);

    assertThatThrownBy(
            () ->
                new DocumentIndex(
                    documentId,
                    "model",
                    List.of(
                        new IndexedChunk(first, new float[] {1, 0}),
                        new IndexedChunk(second, new float[] {1, 0, 0})),
                    Instant.now()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () ->
                new DocumentIndex(
                    documentId,
                    "model",
                    List.of(new IndexedChunk(foreign, new float[] {1, 0})),
                    Instant.now()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new DocumentIndex(documentId, "model", List.of(), Instant.now()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should expose model id, dimension and chunks in order")
  void shouldExposeMetadata() {
    DocumentIndex index = index(new float[] {1, 0}, new float[] {0, 1});

    assertThat(index.documentId()).isEqualTo(documentId);
    assertThat(index.embeddingModelId()).isEqualTo("test-model");
    assertThat(index.dimension()).isEqualTo(2);
    assertThat(index.size()).isEqualTo(2);
    assertThat(index.chunks()).extracting(TextChunk::text).containsExactly("chunk 0", "chunk 1");
  }

  @Test
  @DisplayName("cosine should be zero for a zero vector")
  void cosineShouldBeZero_whenVectorHasZeroNorm() {
    assertThat(VectorSimilarity.cosine(new float[] {0, 0}, new float[] {1, 1})).isZero();
    assertThat(VectorSimilarity.cosine(new float[] {2, 0}, new float[] {5, 0}))
        .isCloseTo(1.0, within(1e-9));
  }

  private DocumentIndex index(float[]... vectors) {
    List<IndexedChunk> entries = new ArrayList<>();
    for (int i = 0; i < vectors.length; i++) {
      TextChunk chunk = new TextChunk(documentId, i, "chunk " + i, i * 10, 0);
      entries.add(new IndexedChunk(chunk, vectors[i]));
    }
    return new DocumentIndex(documentId, "test-model", entries, Instant.now());
  }
}
