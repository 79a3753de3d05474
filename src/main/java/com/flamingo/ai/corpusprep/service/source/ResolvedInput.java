package com.flamingo.ai.corpusprep.service.source;

import com.flamingo.ai.corpusprep.service.model.SkippedSource;
import java.util.List;

/**
 * Sources denoted by one command-line input.
 *
 * @param sources sources in processing order
 * @param skipped directory entries that could not be read
 */
public record ResolvedInput(List<SourceRef> sources, List<SkippedSource> skipped) {

  public ResolvedInput {
    sources = List.copyOf(sources);
    skipped = List.copyOf(skipped);
  }

  static ResolvedInput of(SourceRef source) {
    return new ResolvedInput(List.of(source), List.of());
  }
}
