package com.flamingo.ai.corpusprep.service.extract;

import com.flamingo.ai.corpusprep.service.model.SourceFormat;

/**
 * Raw bytes of one source, ready for extraction.
 *
 * @param sourceId id the extracted documents are recorded under
 * @param format format that selects the extractor
 * @param bytes raw content
 * @param fallbackTitle title used when the content carries none (file stem or URL host)
 * @param url origin URL, {@code null} for local files
 * @param contentType {@code Content-Type} header of a fetched resource, {@code null} for local
 *     files
 */
public record SourceContent(
    String sourceId,
    SourceFormat format,
    byte[] bytes,
    String fallbackTitle,
    String url,
    String contentType) {

  public SourceContent(
      String sourceId, SourceFormat format, byte[] bytes, String fallbackTitle, String url) {
    this(sourceId, format, bytes, fallbackTitle, url, null);
  }
}
