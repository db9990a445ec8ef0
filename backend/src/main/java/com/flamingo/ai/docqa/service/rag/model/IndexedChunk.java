package com.flamingo.ai.docqa.service.rag.model;

import java.util.Objects;

/**
 * A chunk paired with its embedding vector.
 *
 * @param chunk the chunk
 * @param vector embedding of {@code chunk.text()}
 */
public record IndexedChunk(TextChunk chunk, float[] vector) {

  public IndexedChunk {
    Objects.requireNonNull(chunk, "chunk");
    Objects.requireNonNull(vector, "vector");
    vector = vector.clone();
  }

  @Override
  public float[] vector() {
    return vector.clone();
  }
}
