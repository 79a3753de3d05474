package com.flamingo.ai.corpusprep.service.segment;

import java.util.List;

/**
 * Splits normalized text into sentences.
 *
 * <p>Implementations must be safe for concurrent use and must not drop text: joining the returned
 * sentences with single spaces yields the input, up to whitespace collapsing.
 */
public interface SentenceSegmenter {

  /**
   * Splits the text into sentences.
   *
   * @param text normalized text
   * @return sentences in text order; empty when the text is blank
   */
  List<String> segment(String text);

  /** Which kind of boundary detection this segmenter performs. */
  SegmentationMode mode();
}
