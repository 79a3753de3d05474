package com.flamingo.ai.corpusprep.service.source;

import java.nio.file.Path;

/**
 * One source to process, as resolved from a command-line input.
 *
 * @param sourceId id recorded in the corpus: relative path for files found in a directory, the
 *     file name for a single file, the URL for remote sources
 * @param path local file, {@code null} for URLs
 * @param url remote address, {@code null} for local files
 */
public record SourceRef(String sourceId, Path path, String url) {

  public static SourceRef file(String sourceId, Path path) {
    return new SourceRef(sourceId, path, null);
  }

  public static SourceRef url(String url) {
    return new SourceRef(url, null, url);
  }

  public boolean isRemote() {
    return url != null;
  }
}
