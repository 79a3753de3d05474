package com.flamingo.ai.corpusprep.service.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Punctuation-based {@link SentenceSegmenter}: a boundary is a {@code .}, {@code !} or {@code ?}
 * (optionally followed by a closing quote or bracket), then whitespace, then an uppercase letter.
 *
 * <p>This is the degraded mode used when the statistical model is unavailable; it will split after
 * abbreviations such as "Dr." when the next word is capitalized.
 */
public class HeuristicSentenceSegmenter implements SentenceSegmenter {

  private static final Pattern BOUNDARY =
      Pattern.compile("(?<=[.!?][\"')\\]]?)\\s+(?=[\"'(\\[]?\\p{Lu})");

  @Override
  public List<String> segment(String text) {
    List<String> sentences = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return sentences;
    }
    Matcher matcher = BOUNDARY.matcher(text);
    int start = 0;
    while (matcher.find()) {
      addIfNotBlank(sentences, text.substring(start, matcher.start()));
      start = matcher.end();
    }
    addIfNotBlank(sentences, text.substring(start));
    return sentences;
  }

  @Override
  public SegmentationMode mode() {
    return SegmentationMode.HEURISTIC;
  }

  private static void addIfNotBlank(List<String> sentences, String candidate) {
    String trimmed = candidate.trim();
    if (!trimmed.isEmpty()) {
      sentences.add(trimmed);
    }
  }
}
