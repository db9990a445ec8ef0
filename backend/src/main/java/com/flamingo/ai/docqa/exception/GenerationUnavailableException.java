package com.flamingo.ai.docqa.exception;

import com.flamingo.ai.docqa.domain.enums.FailureKind;

/** Exception thrown when the generation model fails, times out or returns nothing. */
public class GenerationUnavailableException extends CapabilityUnavailableException {

  public GenerationUnavailableException(String message) {
    super(FailureKind.GENERATION_UNAVAILABLE, message, false, null);
  }

  public GenerationUnavailableException(String message, boolean timedOut, Throwable cause) {
    super(FailureKind.GENERATION_UNAVAILABLE, message, timedOut, cause);
  }
}
