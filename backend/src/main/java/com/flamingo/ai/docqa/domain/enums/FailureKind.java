package com.flamingo.ai.docqa.domain.enums;

/** Category of a failed pipeline operation, recorded in the query log. */
public enum FailureKind {
  /** Text or question was empty or whitespace-only. */
  EMPTY_INPUT,

  /** The embedding capability failed or timed out. */
  EMBEDDING_UNAVAILABLE,

  /** The generation capability failed or timed out. */
  GENERATION_UNAVAILABLE,

  /** A question was asked before any document was indexed. */
  NO_ACTIVE_DOCUMENT,

  /** Retrieval produced no usable passage for the question. */
  NO_CONTEXT,

  /** The active index was built with a different embedding model. */
  INCOMPATIBLE_INDEX,

  /** A newer upload was published while this index was being built. */
  BUILD_SUPERSEDED
}
