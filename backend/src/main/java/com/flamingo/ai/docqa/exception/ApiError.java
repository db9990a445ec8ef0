package com.flamingo.ai.docqa.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String NO_ACTIVE_DOCUMENT = "DOCUMENT_001";
  public static final String INVALID_UPLOAD = "DOCUMENT_002";
  public static final String TEXT_EXTRACTION_FAILED = "DOCUMENT_003";
  public static final String EMPTY_INPUT = "DOCUMENT_004";
  public static final String BUILD_SUPERSEDED = "INDEX_001";
  public static final String INCOMPATIBLE_INDEX = "INDEX_002";
  public static final String NO_CONTEXT = "RETRIEVAL_001";
  public static final String EMBEDDING_UNAVAILABLE = "LLM_001";
  public static final String GENERATION_UNAVAILABLE = "LLM_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details (only in dev mode). */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
