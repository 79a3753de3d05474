package com.flamingo.ai.corpusprep.service.extract;

import com.flamingo.ai.corpusprep.service.model.Document;
import com.flamingo.ai.corpusprep.service.model.SkippedSource;
import java.util.List;

/**
 * Output of an extractor.
 *
 * @param documents extracted documents in source order
 * @param skipped units of the source that were skipped (JSONL lines), empty for other formats
 */
public record ExtractionResult(List<Document> documents, List<SkippedSource> skipped) {

  public ExtractionResult {
    documents = List.copyOf(documents);
    skipped = List.copyOf(skipped);
  }

  public static ExtractionResult of(Document document) {
    return new ExtractionResult(List.of(document), List.of());
  }
}
