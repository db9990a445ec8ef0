package com.flamingo.ai.docqa.exception;

/** Exception thrown when an uploaded file is rejected before text extraction. */
public class DocumentValidationException extends RuntimeException {

  private final String userMessage;

  public DocumentValidationException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
