package com.flamingo.ai.docqa.domain.enums;

/** Lifecycle state of the question answering backend. */
public enum DocumentState {
  /** No document has been indexed yet; questions are rejected. */
  EMPTY,

  /** Exactly one document and its index are active. */
  READY
}
