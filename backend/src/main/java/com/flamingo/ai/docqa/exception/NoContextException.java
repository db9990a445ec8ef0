package com.flamingo.ai.docqa.exception;

import com.flamingo.ai.docqa.domain.enums.FailureKind;

/** Exception thrown when retrieval yields no passage that could ground an answer. */
public class NoContextException extends PipelineException {

  public NoContextException(String message) {
    super(
        FailureKind.NO_CONTEXT,
        message,
        "The document does not contain content relevant to this question");
  }
}
