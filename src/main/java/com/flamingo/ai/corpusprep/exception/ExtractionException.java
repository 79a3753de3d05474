package com.flamingo.ai.corpusprep.exception;

/**
 * Exception thrown when the content of a single unit (a file, a fetched page, or one JSONL line)
 * cannot be turned into text. The unit is skipped and the run continues.
 */
public class ExtractionException extends RuntimeException {

  private final String source;

  public ExtractionException(String source, String message) {
    super(message);
    this.source = source;
  }

  public ExtractionException(String source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
