package com.flamingo.ai.corpusprep.service.model;

/**
 * A unit of text produced by an extractor, before normalization and segmentation.
 *
 * @param sourceId path relative to the walked directory, file name, URL, or {@code file#L<n>} for
 *     a JSONL record
 * @param format format the text was extracted from
 * @param rawText extracted text
 * @param title document title, {@code null} when none could be determined
 * @param url origin URL, {@code null} for local sources without one
 */
public record Document(
    String sourceId, SourceFormat format, String rawText, String title, String url) {

  public Document withText(String text) {
    return new Document(sourceId, format, text, title, url);
  }
}
