package com.flamingo.ai.docqa.exception;

import com.flamingo.ai.docqa.domain.enums.FailureKind;

/** Base class for typed failures of the chunk / index / retrieve / synthesize pipeline. */
public abstract class PipelineException extends RuntimeException {

  private final FailureKind failureKind;
  private final String userMessage;

  protected PipelineException(FailureKind failureKind, String message, String userMessage) {
    super(message);
    this.failureKind = failureKind;
    this.userMessage = userMessage;
  }

  protected PipelineException(
      FailureKind failureKind, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.failureKind = failureKind;
    this.userMessage = userMessage;
  }

  public FailureKind getFailureKind() {
    return failureKind;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
