package com.flamingo.ai.docqa.exception;

import com.flamingo.ai.docqa.domain.enums.FailureKind;

/**
 * Exception thrown when a query vector is compared against an index built by a different embedding
 * model or with a different dimension.
 */
public class IncompatibleIndexException extends PipelineException {

  public IncompatibleIndexException(String message) {
    super(
        FailureKind.INCOMPATIBLE_INDEX,
        message,
        "The document index is out of date. Please upload the document again.");
  }
}
