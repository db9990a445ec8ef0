package com.flamingo.ai.docqa.service.rag.embedding;

import com.flamingo.ai.docqa.exception.EmbeddingUnavailableException;
import com.flamingo.ai.docqa.service.rag.capability.CapabilityInvoker;
import com.flamingo.ai.docqa.service.rag.capability.ModelCapability;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds document chunks and questions through the model capability.
 *
 * <p>Passages and queries go through the same capability, so vectors produced here are always
 * comparable with each other as long as {@link #modelId()} is unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; stay well below it for dense CJK text
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final ModelCapability modelCapability;
  private final CapabilityInvoker capabilityInvoker;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a question.
   *
   * @param query the question text
   * @return embedding vector
   * @throws EmbeddingUnavailableException if the capability fails or returns an empty vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  public float[] embedQuery(String query) {
    log.debug("embedQuery called, input length: {} chars", query.length());
    return embed(query, "query");
  }

  /**
   * Embeds a document chunk.
   *
   * @param passage the chunk text
   * @return embedding vector
   * @throws EmbeddingUnavailableException if the capability fails or returns an empty vector
   */
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  public float[] embedPassage(String passage) {
    log.debug("embedPassage called, input length: {} chars", passage.length());
    return embed(passage, "passage");
  }

  /** Identifier of the model behind every vector this service returns. */
  public String modelId() {
    return modelCapability.embeddingModelId();
  }

  private float[] embed(String text, String type) {
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }

    String finalInput = input;
    float[] vector =
        capabilityInvoker.invoke(
            "embed", () -> modelCapability.embed(finalInput), EmbeddingUnavailableException::new);

    if (vector == null || vector.length == 0) {
      meterRegistry.counter("embedding.requests.failure", "type", type).increment();
      throw new EmbeddingUnavailableException("Embedding capability returned an empty vector");
    }
    meterRegistry.counter("embedding.requests.success", "type", type).increment();
    return vector;
  }
}
