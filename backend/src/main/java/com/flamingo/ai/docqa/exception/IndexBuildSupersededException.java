package com.flamingo.ai.docqa.exception;

import com.flamingo.ai.docqa.domain.enums.FailureKind;
import java.util.UUID;

/** Exception thrown when an index build finished after a newer upload had been published. */
public class IndexBuildSupersededException extends PipelineException {

  private final UUID documentId;

  public IndexBuildSupersededException(UUID documentId, String fileName) {
    super(
        FailureKind.BUILD_SUPERSEDED,
        String.format(
            "Index build for %s (%s) was superseded by a newer upload", fileName, documentId),
        "A newer document was uploaded while this one was being processed");
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
