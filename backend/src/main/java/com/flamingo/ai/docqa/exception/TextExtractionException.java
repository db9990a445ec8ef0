package com.flamingo.ai.docqa.exception;

/** Exception thrown when no text can be extracted from an uploaded file. */
public class TextExtractionException extends RuntimeException {

  private final String fileName;

  public TextExtractionException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
  }

  public TextExtractionException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return "Failed to extract text from PDF";
  }
}
