package com.flamingo.ai.docqa.exception;

import com.flamingo.ai.docqa.domain.enums.FailureKind;

/** Exception thrown when text handed to the pipeline is empty or whitespace-only. */
public class EmptyInputException extends PipelineException {

  public EmptyInputException(String message) {
    super(FailureKind.EMPTY_INPUT, message, "The provided text is empty");
  }
}
