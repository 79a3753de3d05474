package com.flamingo.ai.corpusprep.service.chunk;

/** Approximates tokens as one per four characters, rounded up. */
public class CharacterCountTokenEstimator implements TokenEstimator {

  private static final int CHARS_PER_TOKEN = 4;

  @Override
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
  }
}
