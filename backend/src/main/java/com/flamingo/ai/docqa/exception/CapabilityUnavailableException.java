package com.flamingo.ai.docqa.exception;

import com.flamingo.ai.docqa.domain.enums.FailureKind;

/** Exception thrown when the external embedding or generation capability cannot be reached. */
public abstract class CapabilityUnavailableException extends PipelineException {

  private final boolean timedOut;

  protected CapabilityUnavailableException(
      FailureKind failureKind, String message, boolean timedOut, Throwable cause) {
    super(
        failureKind,
        message,
        timedOut
            ? "AI service did not respond in time. Please try again later."
            : "AI service is temporarily unavailable. Please try again later.",
        cause);
    this.timedOut = timedOut;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
