package com.flamingo.ai.corpusprep.service.extract;

import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a {@link SourceFormat} to the {@link DocumentExtractor} registered for it.
 *
 * <p>Extractors are injected by Spring. Adding a format means adding a {@link SourceFormat}
 * variant and an extractor bean; call sites never branch on the format.
 */
@Service
@Slf4j
public class ExtractorRegistry {

  private final Map<SourceFormat, DocumentExtractor> extractors =
      new EnumMap<>(SourceFormat.class);

  public ExtractorRegistry(List<DocumentExtractor> extractors) {
    for (DocumentExtractor extractor : extractors) {
      DocumentExtractor previous = this.extractors.put(extractor.format(), extractor);
      if (previous != null) {
        throw new IllegalStateException(
            "Two extractors registered for "
                + extractor.format()
                + ": "
                + previous.getClass().getSimpleName()
                + " and "
                + extractor.getClass().getSimpleName());
      }
    }
    log.debug("Registered extractors for formats {}", this.extractors.keySet());
  }

  /**
   * Returns the extractor for the given format.
   *
   * @param format source format
   * @return the registered extractor
   * @throws IllegalStateException if no extractor is registered for the format
   */
  public DocumentExtractor route(SourceFormat format) {
    DocumentExtractor extractor = extractors.get(format);
    if (extractor == null) {
      throw new IllegalStateException("No DocumentExtractor registered for format: " + format);
    }
    return extractor;
  }
}
