package com.flamingo.ai.corpusprep.service.model;

/**
 * One sentence of a document.
 *
 * @param index 0-based position of the sentence within its document
 * @param text sentence text, never blank
 * @param tokenCount estimated token count of {@code text}
 */
public record Sentence(int index, String text, int tokenCount) {}
