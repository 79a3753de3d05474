package com.flamingo.ai.corpusprep.service.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Input formats the pipeline can extract text from. Each variant is handled by exactly one {@link
 * com.flamingo.ai.corpusprep.service.extract.DocumentExtractor}.
 */
public enum SourceFormat {
  HTML(Set.of("html", "htm"), Set.of("text/html", "application/xhtml+xml")),
  PDF(Set.of("pdf"), Set.of("application/pdf")),
  MARKDOWN(Set.of("md", "markdown"), Set.of("text/markdown", "text/x-markdown")),
  PLAIN_TEXT(Set.of("txt"), Set.of("text/plain")),
  JSONL(
      Set.of("jsonl"),
      Set.of("application/jsonl", "application/x-ndjson", "application/x-jsonlines"));

  private final Set<String> extensions;
  private final Set<String> mimeTypes;

  SourceFormat(Set<String> extensions, Set<String> mimeTypes) {
    this.extensions = extensions;
    this.mimeTypes = mimeTypes;
  }

  /**
   * Resolves a format from a file name or URL path by its extension (case-insensitive).
   *
   * @param name file name or path
   * @return the matching format, or empty when the extension is unknown or missing
   */
  public static Optional<SourceFormat> fromFileName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String extension = extensionOf(name);
    if (extension.isEmpty()) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(f -> f.extensions.contains(extension)).findFirst();
  }

  /**
   * Resolves a format from an HTTP {@code Content-Type} header value. Parameters such as {@code
   * charset} are ignored.
   */
  public static Optional<SourceFormat> fromContentType(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return Optional.empty();
    }
    String mimeType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(f -> f.mimeTypes.contains(mimeType)).findFirst();
  }

  static String extensionOf(String name) {
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    String fileName = name.substring(slash + 1);
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
