package com.flamingo.ai.corpusprep.service.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextNormalizer Tests")
class TextNormalizerTest {

  private final TextNormalizer normalizer = new TextNormalizer();

  @Test
  @DisplayName("should return empty string for null or empty input")
  void shouldReturnEmpty_whenInputIsNullOrEmpty() {
    assertThat(normalizer.normalize(null)).isEmpty();
    assertThat(normalizer.normalize("")).isEmpty();
    assertThat(normalizer.normalize(" \t\n ")).isEmpty();
  }

  @Test
  @DisplayName("should replace curly quotes and typographic dashes with ASCII")
  void shouldCanonicalizeQuotesAndDashes() {
    String input = "\u201CHello\u201D \u2014 it\u2019s 5\u20133 \u2212 1 and well-known";

    assertThat(normalizer.normalize(input)).isEqualTo("\"Hello\" - it's 5-3 - 1 and well-known");
  }

  @Test
  @DisplayName("should collapse Unicode spaces, tabs and newlines into single spaces")
  void shouldCollapseWhitespace() {
    String input = "  a\u00A0\u00A0b\t\n\u2003c d  ";

    assertThat(normalizer.normalize(input)).isEqualTo("a b c d");
  }

  @Test
  @DisplayName("should remove control and zero-width format characters")
  void shouldRemoveControlAndFormatCharacters() {
    assertThat(normalizer.normalize("zero\u200Bwidth")).isEqualTo("zerowidth");
    assertThat(normalizer.normalize("a \u0007 b")).isEqualTo("a b");
    assertThat(normalizer.normalize("\uFEFFstart")).isEqualTo("start");
  }

  @Test
  @DisplayName("should compose decomposed characters to NFC")
  void shouldComposeToNfc() {
    assertThat(normalizer.normalize("Cafe\u0301")).isEqualTo("Caf\u00E9");
  }

  @Test
  @DisplayName("should be idempotent")
  void shouldBeIdempotent() {
    String once = normalizer.normalize("\u2018One\u2019 \u00A0\u2013\ttwo\u0000 three ");

    assertThat(normalizer.normalize(once)).isEqualTo(once);
  }
}
