package com.flamingo.ai.corpusprep.service.pipeline;

import com.flamingo.ai.corpusprep.service.model.SkipReason;
import com.flamingo.ai.corpusprep.service.model.SkippedSource;
import java.util.List;

/**
 * Everything one source contributed to a run, handed from a worker to the writing thread.
 *
 * @param sourceId id of the source
 * @param documents documents with at least one chunk, in source order
 * @param skipped the source itself or its records that were left out
 */
record SourceResult(
    String sourceId, List<ProcessedDocument> documents, List<SkippedSource> skipped) {

  static SourceResult skipped(String sourceId, SkipReason reason, String detail) {
    return new SourceResult(
        sourceId, List.of(), List.of(new SkippedSource(sourceId, reason, detail)));
  }
}
