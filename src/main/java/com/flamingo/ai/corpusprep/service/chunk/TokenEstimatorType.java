package com.flamingo.ai.corpusprep.service.chunk;

/** Selectable token estimation strategies. */
public enum TokenEstimatorType {
  WORDS,
  CHARACTERS;

  /**
   * Creates the estimator for this type.
   *
   * @param tokensPerWord scale factor, used by {@link #WORDS} only
   */
  public TokenEstimator create(double tokensPerWord) {
    return switch (this) {
      case WORDS -> new WordCountTokenEstimator(tokensPerWord);
      case CHARACTERS -> new CharacterCountTokenEstimator();
    };
  }
}
