package com.flamingo.ai.corpusprep.service.segment;

/** Boundary detection in use for a run. */
public enum SegmentationMode {
  /** OpenNLP maximum-entropy sentence model. */
  STATISTICAL,
  /** Punctuation heuristic used when no sentence model could be loaded. */
  HEURISTIC
}
