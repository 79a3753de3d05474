package com.flamingo.ai.corpusprep.exception;

/** Exception thrown when a source has a file extension no extractor handles. */
public class UnsupportedFormatException extends RuntimeException {

  private final String source;

  public UnsupportedFormatException(String source, String message) {
    super(message);
    this.source = source;
  }

  public String getSource() {
    return source;
  }
}
