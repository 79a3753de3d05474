package com.flamingo.ai.corpusprep.service.chunk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TokenEstimator Tests")
class TokenEstimatorTest {

  @Nested
  @DisplayName("WordCountTokenEstimator")
  class WordCount {

    @Test
    @DisplayName("should count whitespace-delimited words")
    void shouldCountWords() {
      TokenEstimator estimator = new WordCountTokenEstimator(1.0);

      assertThat(estimator.estimate("one two three")).isEqualTo(3);
      assertThat(estimator.estimate("  spaced   out\twords ")).isEqualTo(3);
      assertThat(estimator.estimate("")).isZero();
      assertThat(estimator.estimate("   ")).isZero();
    }

    @Test
    @DisplayName("should scale the word count and round up")
    void shouldScaleAndRoundUp() {
      TokenEstimator estimator = new WordCountTokenEstimator(1.3);

      assertThat(estimator.estimate("one two three")).isEqualTo(4);
    }

    @Test
    @DisplayName("should reject a non-positive factor")
    void shouldRejectNonPositiveFactor() {
      assertThatThrownBy(() -> new WordCountTokenEstimator(0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("CharacterCountTokenEstimator")
  class CharacterCount {

    private final TokenEstimator estimator = new CharacterCountTokenEstimator();

    @Test
    @DisplayName("should count one token per four characters, rounded up")
    void shouldDivideByFour() {
      assertThat(estimator.estimate("abcd")).isEqualTo(1);
      assertThat(estimator.estimate("abcde")).isEqualTo(2);
      assertThat(estimator.estimate("")).isZero();
    }
  }

  @Test
  @DisplayName("should create the estimator matching the type")
  void shouldCreateEstimatorForType() {
    assertThat(TokenEstimatorType.WORDS.create(1.0)).isInstanceOf(WordCountTokenEstimator.class);
    assertThat(TokenEstimatorType.CHARACTERS.create(1.0))
        .isInstanceOf(CharacterCountTokenEstimator.class);
  }
}
