package com.flamingo.ai.docqa.service.rag.retrieval;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.EmptyInputException;
import com.flamingo.ai.docqa.exception.IncompatibleIndexException;
import com.flamingo.ai.docqa.exception.NoActiveDocumentException;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docqa.service.rag.index.DocumentIndex;
import com.flamingo.ai.docqa.service.rag.model.ScoredChunk;
import com.flamingo.ai.docqa.service.state.ActiveDocument;
import com.flamingo.ai.docqa.service.state.DocumentStateManager;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Finds the chunks of the active document most similar to a question. */
@Service
@RequiredArgsConstructor
@Slf4j
public class Retriever {

  private final DocumentStateManager stateManager;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;

  /**
   * Retrieves from the currently active document.
   *
   * @param question the question text
   * @param k requested number of chunks, clamped to the configured range
   * @return scored chunks, best first
   * @throws NoActiveDocumentException if no document has been indexed yet
   */
  public List<ScoredChunk> retrieve(String question, int k) {
    ActiveDocument active = stateManager.snapshot().orElseThrow(NoActiveDocumentException::new);
    return retrieve(active.index(), question, k);
  }

  /**
   * Retrieves from a given index snapshot.
   *
   * <p>Scores are in [0, 1]; chunks scoring at or below {@code rag.retrieval.min-score} are left
   * out, so the result may be empty.
   *
   * @param index index snapshot to search
   * @param question the question text
   * @param k requested number of chunks, clamped to the configured range
   * @return scored chunks, best first
   * @throws IncompatibleIndexException if the index was built with another embedding model
   */
  @Timed(value = "retrieval.retrieve", description = "Time to retrieve context for a question")
  public List<ScoredChunk> retrieve(DocumentIndex index, String question, int k) {
    if (question == null || question.isBlank()) {
      throw new EmptyInputException("Question is empty");
    }
    String modelId = embeddingService.modelId();
    if (!index.embeddingModelId().equals(modelId)) {
      throw new IncompatibleIndexException(
          String.format(
              "Index for %s was built with model %s but queries use %s",
              index.documentId(), index.embeddingModelId(), modelId));
    }

    RagConfig.Retrieval config = ragConfig.getRetrieval();
    int effectiveK = Math.max(config.getMinTopK(), Math.min(k, config.getMaxTopK()));

    float[] queryVector = embeddingService.embedQuery(question);
    List<ScoredChunk> results =
        index.search(queryVector, effectiveK).stream()
            .filter(scored -> scored.score() > config.getMinScore())
            .toList();

    log.debug(
        "Retrieved {} of {} requested chunks (k={}) from document {}; top score {}",
        results.size(),
        effectiveK,
        k,
        index.documentId(),
        results.isEmpty() ? "n/a" : String.format("%.3f", results.get(0).score()));
    return results;
  }
}
