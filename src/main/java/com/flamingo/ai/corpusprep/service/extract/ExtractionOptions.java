package com.flamingo.ai.corpusprep.service.extract;

/**
 * Per-run extraction settings.
 *
 * @param jsonlTextKey field holding the text of each JSONL record
 */
public record ExtractionOptions(String jsonlTextKey) {

  public static final String DEFAULT_JSONL_TEXT_KEY = "text";

  public ExtractionOptions {
    if (jsonlTextKey == null || jsonlTextKey.isBlank()) {
      jsonlTextKey = DEFAULT_JSONL_TEXT_KEY;
    }
  }
}
