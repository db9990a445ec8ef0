package com.flamingo.ai.docqa.service.state;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.service.rag.index.DocumentIndex;
import java.time.Instant;
import java.util.Objects;

/**
 * The document questions are currently answered from, paired with its index.
 *
 * @param document persisted document
 * @param index fully built index of that document
 * @param activatedAt when the pair was published
 */
public record ActiveDocument(Document document, DocumentIndex index, Instant activatedAt) {

  public ActiveDocument {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(index, "index");
    Objects.requireNonNull(activatedAt, "activatedAt");
    if (!index.documentId().equals(document.getId())) {
      throw new IllegalArgumentException(
          "Index " + index.documentId() + " does not belong to document " + document.getId());
    }
  }
}
