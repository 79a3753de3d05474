package com.flamingo.ai.corpusprep.service.chunk;

/**
 * Parameters of one chunking run.
 *
 * @param maxTokens token budget per chunk, at least 1
 * @param overlapSentences trailing sentences of a chunk repeated at the start of the next one
 * @param tokenEstimator estimator used for every sentence of the run
 */
public record ChunkingParams(int maxTokens, int overlapSentences, TokenEstimator tokenEstimator) {

  public ChunkingParams {
    if (maxTokens < 1) {
      throw new IllegalArgumentException("maxTokens must be at least 1: " + maxTokens);
    }
    if (overlapSentences < 0) {
      throw new IllegalArgumentException(
          "overlapSentences must not be negative: " + overlapSentences);
    }
    if (tokenEstimator == null) {
      throw new IllegalArgumentException("tokenEstimator must not be null");
    }
  }
}
