package com.flamingo.ai.corpusprep.service.extract;

import com.flamingo.ai.corpusprep.service.model.SourceFormat;

/**
 * Turns the raw bytes of a source into one or more {@link
 * com.flamingo.ai.corpusprep.service.model.Document}s.
 *
 * <p>There is one implementation per {@link SourceFormat}. Implementations must be stateless so a
 * single instance can be shared across worker threads. Extracted text is not normalized yet; the
 * pipeline normalizes every document the same way afterwards.
 */
public interface DocumentExtractor {

  /** The format this extractor handles. */
  SourceFormat format();

  /**
   * Extracts the source.
   *
   * @param content raw source bytes and identity
   * @param options per-run settings
   * @return extracted documents, plus any records skipped inside the source
   * @throws com.flamingo.ai.corpusprep.exception.ExtractionException if the content is malformed
   */
  ExtractionResult extract(SourceContent content, ExtractionOptions options);
}
