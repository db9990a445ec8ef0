package com.flamingo.ai.docqa.service.rag.chunking;

import com.flamingo.ai.docqa.service.rag.model.ChunkSpan;
import java.util.List;

/**
 * Splits extracted document text into overlapping {@link ChunkSpan}s ready for embedding.
 *
 * <p>Implementations must be stateless, safe for concurrent use and deterministic: the same text
 * and parameters always yield the same sequence.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from plain text.
   *
   * @param text extracted document text
   * @param targetSize maximum chunk length in characters
   * @param overlap characters shared by adjacent chunks; must be smaller than {@code targetSize}
   * @return ordered, non-empty list of chunks
   * @throws com.flamingo.ai.docqa.exception.EmptyInputException if text is blank
   */
  List<ChunkSpan> chunk(String text, int targetSize, int overlap);
}
