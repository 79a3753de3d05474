package com.flamingo.ai.corpusprep.service.segment;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HeuristicSentenceSegmenter Tests")
class HeuristicSentenceSegmenterTest {

  private final HeuristicSentenceSegmenter segmenter = new HeuristicSentenceSegmenter();

  @Test
  @DisplayName("should split on terminal punctuation followed by an uppercase letter")
  void shouldSplitOnTerminalPunctuation() {
    List<String> sentences = segmenter.segment("Hello world. This is a test! Is it? Yes.");

    assertThat(sentences).containsExactly("Hello world.", "This is a test!", "Is it?", "Yes.");
  }

  @Test
  @DisplayName("should not split inside decimals or before lowercase words")
  void shouldNotSplit_whenNoUppercaseFollows() {
    List<String> sentences =
        segmenter.segment("The value is 3.14 today, e.g. the usual one. Next sentence.");

    assertThat(sentences)
        .containsExactly("The value is 3.14 today, e.g. the usual one.", "Next sentence.");
  }

  @Test
  @DisplayName("should keep closing quotes with the sentence they end")
  void shouldKeepClosingQuote() {
    List<String> sentences = segmenter.segment("He said \"Stop.\" Then he left.");

    assertThat(sentences).containsExactly("He said \"Stop.\"", "Then he left.");
  }

  @Test
  @DisplayName("should return empty list for blank input")
  void shouldReturnEmpty_whenBlank() {
    assertThat(segmenter.segment("")).isEmpty();
    assertThat(segmenter.segment("   ")).isEmpty();
    assertThat(segmenter.segment(null)).isEmpty();
  }

  @Test
  @DisplayName("should reconstruct normalized input when sentences are joined with spaces")
  void shouldNotDropCharacters() {
    String text = "First one. Second one! Third, with 2.5 units? Fourth \"quoted.\" Fifth";

    assertThat(String.join(" ", segmenter.segment(text))).isEqualTo(text);
  }

  @Test
  @DisplayName("should report heuristic mode")
  void shouldReportHeuristicMode() {
    assertThat(segmenter.mode()).isEqualTo(SegmentationMode.HEURISTIC);
  }
}
