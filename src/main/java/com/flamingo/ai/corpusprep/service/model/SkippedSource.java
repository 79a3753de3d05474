package com.flamingo.ai.corpusprep.service.model;

/**
 * A source or record left out of the corpus, reported in the end-of-run summary.
 *
 * @param source source id, path, URL or {@code file#L<n>} of the skipped unit
 * @param reason category of the failure
 * @param detail human-readable explanation
 */
public record SkippedSource(String source, SkipReason reason, String detail) {}
