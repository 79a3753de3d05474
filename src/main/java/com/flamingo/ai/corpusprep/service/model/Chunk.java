package com.flamingo.ai.corpusprep.service.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A token-budgeted window of consecutive sentences from one document.
 *
 * @param sourceId id of the document the sentences belong to
 * @param chunkIndex 0-based position in emission order
 * @param sentences the sentences, in document order
 * @param tokenCount sum of the sentences' estimated token counts
 */
public record Chunk(String sourceId, int chunkIndex, List<Sentence> sentences, int tokenCount) {

  public Chunk {
    sentences = List.copyOf(sentences);
  }

  /** Sentence texts joined with single spaces. */
  public String text() {
    return sentences.stream().map(Sentence::text).collect(Collectors.joining(" "));
  }

  public int firstSentenceIndex() {
    return sentences.get(0).index();
  }

  public int lastSentenceIndex() {
    return sentences.get(sentences.size() - 1).index();
  }
}
