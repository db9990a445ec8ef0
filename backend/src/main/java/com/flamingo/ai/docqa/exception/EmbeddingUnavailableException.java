package com.flamingo.ai.docqa.exception;

import com.flamingo.ai.docqa.domain.enums.FailureKind;

/** Exception thrown when text cannot be embedded (transport, quota, timeout, bad vector). */
public class EmbeddingUnavailableException extends CapabilityUnavailableException {

  public EmbeddingUnavailableException(String message) {
    super(FailureKind.EMBEDDING_UNAVAILABLE, message, false, null);
  }

  public EmbeddingUnavailableException(String message, boolean timedOut, Throwable cause) {
    super(FailureKind.EMBEDDING_UNAVAILABLE, message, timedOut, cause);
  }
}
