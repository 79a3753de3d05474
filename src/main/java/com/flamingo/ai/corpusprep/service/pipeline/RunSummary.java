package com.flamingo.ai.corpusprep.service.pipeline;

import com.flamingo.ai.corpusprep.service.model.SkippedSource;
import com.flamingo.ai.corpusprep.service.segment.SegmentationMode;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a completed run.
 *
 * @param output corpus file that was written
 * @param documents documents that produced at least one record
 * @param chunks chunks emitted over all documents
 * @param records records written to the corpus file
 * @param skipped sources and records left out, in processing order
 * @param segmentationMode how sentences were detected
 */
public record RunSummary(
    Path output,
    int documents,
    int chunks,
    long records,
    List<SkippedSource> skipped,
    SegmentationMode segmentationMode) {

  public RunSummary {
    skipped = List.copyOf(skipped);
  }

  public boolean hasDocuments() {
    return documents > 0;
  }
}
