package com.flamingo.ai.docqa.service.rag.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A chunk of a specific document. Never mutated; lives as long as its document's index.
 *
 * @param documentId parent document
 * @param sequenceIndex zero-based position within the document
 * @param text chunk content
 * @param startOffset character offset in the document text
 * @param overlapChars leading characters repeated from the previous chunk
 */
public record TextChunk(
    UUID documentId, int sequenceIndex, String text, int startOffset, int overlapChars) {

  public TextChunk {
    Objects.requireNonNull(documentId, "documentId");
    Objects.requireNonNull(text, "text");
  }

  /** Binds a chunker span to its parent document. */
  public static TextChunk of(UUID documentId, ChunkSpan span) {
    return new TextChunk(
        documentId, span.sequenceIndex(), span.text(), span.startOffset(), span.overlapChars());
  }
}
