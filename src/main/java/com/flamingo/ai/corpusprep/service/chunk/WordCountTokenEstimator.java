package com.flamingo.ai.corpusprep.service.chunk;

import java.util.regex.Pattern;

/** Counts whitespace-delimited words and scales the count by a fixed tokens-per-word factor. */
public class WordCountTokenEstimator implements TokenEstimator {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final double tokensPerWord;

  public WordCountTokenEstimator(double tokensPerWord) {
    if (!(tokensPerWord > 0)) {
      throw new IllegalArgumentException("tokensPerWord must be positive: " + tokensPerWord);
    }
    this.tokensPerWord = tokensPerWord;
  }

  @Override
  public int estimate(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    int words = WHITESPACE.split(text.trim()).length;
    return (int) Math.ceil(words * tokensPerWord);
  }
}
