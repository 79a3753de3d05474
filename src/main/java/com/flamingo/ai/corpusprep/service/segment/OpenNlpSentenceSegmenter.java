package com.flamingo.ai.corpusprep.service.segment;

import java.util.ArrayList;
import java.util.List;
import opennlp.tools.sentdetect.SentenceDetectorME;
import opennlp.tools.sentdetect.SentenceModel;
import opennlp.tools.util.Span;

/**
 * {@link SentenceSegmenter} backed by an OpenNLP {@link SentenceModel}.
 *
 * <p>The model is shared; {@link SentenceDetectorME} is not thread-safe, so each call builds its
 * own detector. Sentences are cut at the start offsets of the detected spans rather than taken from
 * the spans themselves, so text the model leaves between spans stays attached to the preceding
 * sentence instead of being lost.
 */
public class OpenNlpSentenceSegmenter implements SentenceSegmenter {

  private final SentenceModel model;

  public OpenNlpSentenceSegmenter(SentenceModel model) {
    this.model = model;
  }

  @Override
  public List<String> segment(String text) {
    List<String> sentences = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return sentences;
    }
    Span[] spans = new SentenceDetectorME(model).sentPosDetect(text);
    if (spans.length == 0) {
      sentences.add(text.trim());
      return sentences;
    }
    int start = 0;
    for (int i = 1; i < spans.length; i++) {
      addIfNotBlank(sentences, text.substring(start, spans[i].getStart()));
      start = spans[i].getStart();
    }
    addIfNotBlank(sentences, text.substring(start));
    return sentences;
  }

  @Override
  public SegmentationMode mode() {
    return SegmentationMode.STATISTICAL;
  }

  private static void addIfNotBlank(List<String> sentences, String candidate) {
    String trimmed = candidate.trim();
    if (!trimmed.isEmpty()) {
      sentences.add(trimmed);
    }
  }
}
