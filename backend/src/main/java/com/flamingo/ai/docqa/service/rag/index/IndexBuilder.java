package com.flamingo.ai.docqa.service.rag.index;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.exception.EmbeddingUnavailableException;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docqa.service.rag.model.ChunkSpan;
import com.flamingo.ai.docqa.service.rag.model.IndexedChunk;
import com.flamingo.ai.docqa.service.rag.model.TextChunk;
import io.micrometer.core.annotation.Timed;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds every chunk of a document and assembles a {@link DocumentIndex}.
 *
 * <p>All-or-nothing: the first chunk that cannot be embedded aborts the build, and no partial index
 * ever leaves this class.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexBuilder {

  private final EmbeddingService embeddingService;

  /**
   * Builds the index for a document.
   *
   * @param document the persisted document the spans were cut from
   * @param spans chunker output for the document text
   * @return a complete index with one vector per span
   * @throws EmbeddingUnavailableException if any chunk fails to embed or dimensions disagree
   */
  @Timed(value = "index.build", description = "Time to embed and index a document")
  public DocumentIndex build(Document document, List<ChunkSpan> spans) {
    if (spans == null || spans.isEmpty()) {
      throw new IllegalArgumentException("Cannot build an index without chunks");
    }
    String modelId = embeddingService.modelId();
    log.debug(
        "Building index for document {} with {} chunks using model {}",
        document.getId(),
        spans.size(),
        modelId);

    List<IndexedChunk> entries = new ArrayList<>(spans.size());
    int dimension = -1;
    for (ChunkSpan span : spans) {
      float[] vector;
      try {
        vector = embeddingService.embedPassage(span.text());
      } catch (EmbeddingUnavailableException e) {
        log.warn(
            "Embedding failed for chunk {}/{} of document {}; discarding partial index",
            span.sequenceIndex() + 1,
            spans.size(),
            document.getId());
        throw e;
      }

      if (dimension < 0) {
        dimension = vector.length;
      } else if (vector.length != dimension) {
        throw new EmbeddingUnavailableException(
            String.format(
                "Chunk %d embedded to %d dimensions, expected %d",
                span.sequenceIndex(), vector.length, dimension));
      }
      entries.add(new IndexedChunk(TextChunk.of(document.getId(), span), vector));
    }

    DocumentIndex index = new DocumentIndex(document.getId(), modelId, entries, Instant.now());
    log.info(
        "Built index for document {} ({}): {} chunks, dimension {}",
        document.getId(),
        document.getFileName(),
        index.size(),
        index.dimension());
    return index;
  }
}
