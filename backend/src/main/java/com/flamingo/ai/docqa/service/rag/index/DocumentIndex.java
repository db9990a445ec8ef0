package com.flamingo.ai.docqa.service.rag.index;

import com.flamingo.ai.docqa.exception.IncompatibleIndexException;
import com.flamingo.ai.docqa.service.rag.model.IndexedChunk;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.rag.model.TextChunk;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable in-memory vector index for exactly one document.
 *
 * <p>Built completely before it is published, never modified afterwards, so any number of threads
 * may search it concurrently.
 */
public final class DocumentIndex {

  private final UUID documentId;
  private final String embeddingModelId;
  private final int dimension;
  private final List<IndexedChunk> entries;
  private final Instant builtAt;

  public DocumentIndex(
      UUID documentId, String embeddingModelId, List<IndexedChunk> entries, Instant builtAt) {
    this.documentId = Objects.requireNonNull(documentId, "documentId");
    this.embeddingModelId = Objects.requireNonNull(embeddingModelId, "embeddingModelId");
    this.builtAt = Objects.requireNonNull(builtAt, "builtAt");
    if (entries == null || entries.isEmpty()) {
      throw new IllegalArgumentException("An index needs at least one chunk");
    }
    this.dimension = entries.get(0).vector().length;
    for (IndexedChunk entry : entries) {
      if (!documentId.equals(entry.chunk().documentId())) {
        throw new IllegalArgumentException(
            "Chunk " + entry.chunk().sequenceIndex() + " belongs to another document");
      }
      if (entry.vector().length != dimension) {
        throw new IllegalArgumentException(
            "Chunk " + entry.chunk().sequenceIndex() + " has a vector of a different dimension");
      }
    }
    this.entries = List.copyOf(entries);
  }

  /**
   * Returns the {@code k} chunks most similar to the query vector.
   *
   * <p>Ordered by descending cosine similarity; equal similarities are ordered by ascending chunk
   * sequence index. The reported score is the cosine clamped to [0, 1].
   *
   * @param queryVector query embedding, produced by {@link #embeddingModelId()}
   * @param k number of results; values below 1 yield an empty list
   * @return at most {@code k} scored chunks
   * @throws IncompatibleIndexException if the query dimension differs from the index dimension
   */
  public List<ScoredChunk> search(float[] queryVector, int k) {
    if (queryVector.length != dimension) {
      throw new IncompatibleIndexException(
          String.format(
              "Query vector has dimension %d but index for %s has %d",
              queryVector.length, documentId, dimension));
    }
    if (k <= 0) {
      return List.of();
    }

    List<Candidate> candidates = new ArrayList<>(entries.size());
    for (IndexedChunk entry : entries) {
      candidates.add(
          new Candidate(entry.chunk(), VectorSimilarity.cosine(queryVector, entry.vector())));
    }
    candidates.sort(
        Comparator.comparingDouble(Candidate::cosine)
            .reversed()
            .thenComparingInt(c -> c.chunk().sequenceIndex()));

    return candidates.stream()
        .limit(k)
        .map(c -> new ScoredChunk(c.chunk(), Math.max(0.0, c.cosine())))
        .toList();
  }

  public UUID documentId() {
    return documentId;
  }

  public String embeddingModelId() {
    return embeddingModelId;
  }

  public int dimension() {
    return dimension;
  }

  public int size() {
    return entries.size();
  }

  public Instant builtAt() {
    return builtAt;
  }

  /** Chunks in sequence order. */
  public List<TextChunk> chunks() {
    return entries.stream().map(IndexedChunk::chunk).toList();
  }

  private record Candidate(TextChunk chunk, double cosine) {}
}
