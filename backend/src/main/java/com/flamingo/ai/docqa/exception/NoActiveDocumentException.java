package com.flamingo.ai.docqa.exception;

import com.flamingo.ai.docqa.domain.enums.FailureKind;

/** Exception thrown when a question arrives before any document has been indexed. */
public class NoActiveDocumentException extends PipelineException {

  public NoActiveDocumentException() {
    super(
        FailureKind.NO_ACTIVE_DOCUMENT,
        "No active document",
        "No document found. Please upload a PDF first.");
  }
}
