package com.flamingo.ai.corpusprep.exception;

/** Exception thrown when a URL source could not be fetched after all retry attempts. */
public class NetworkFetchException extends RuntimeException {

  private final String url;
  private final int attempts;

  public NetworkFetchException(String url, int attempts, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
    this.attempts = attempts;
  }

  public String getUrl() {
    return url;
  }

  public int getAttempts() {
    return attempts;
  }
}
