package com.flamingo.ai.docqa.service.rag.capability;

/**
 * The external embedding and generation model, consumed as a black box.
 *
 * <p>Implementations may block on network I/O and may throw any runtime exception; callers go
 * through {@link CapabilityInvoker} to bound and classify those calls.
 */
public interface ModelCapability {

  /**
   * Maps text to a fixed-length vector.
   *
   * @param text text to embed
   * @return embedding vector
   */
  float[] embed(String text);

  /**
   * Generates text for a fully assembled prompt.
   *
   * @param prompt the prompt
   * @return generated text
   */
  String generate(String prompt);

  /**
   * Identifies the embedding model. Vectors from different identifiers are not comparable.
   *
   * @return embedding model identifier
   */
  default String embeddingModelId() {
    return getClass().getName();
  }
}
