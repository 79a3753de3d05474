package com.flamingo.ai.corpusprep.exception;

import java.nio.file.Path;

/** Exception thrown when an output file cannot be opened or written. Always fatal for the run. */
public class OutputWriteException extends RuntimeException {

  private final Path path;

  public OutputWriteException(Path path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
