package com.flamingo.ai.corpusprep.service.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusprep.exception.ExtractionException;
import com.flamingo.ai.corpusprep.service.model.Document;
import com.flamingo.ai.corpusprep.service.model.SkipReason;
import com.flamingo.ai.corpusprep.service.model.SkippedSource;
import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentExtractor} for JSON Lines corpora ({@code .jsonl}).
 *
 * <p>Every non-blank line must be a JSON object. The text is read from the field named by {@link
 * ExtractionOptions#jsonlTextKey()}; each record with a non-blank text becomes its own {@link
 * Document} with source id {@code <source>#L<line>}. Records are skipped, with a warning, when the
 * line is not valid JSON, is not an object, or lacks a non-blank string under the text key. A bad
 * line never affects the other lines.
 *
 * <p>Optional {@code title}, {@code source} and {@code url} fields supply the title and origin URL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonlDocumentExtractor implements DocumentExtractor {

  private final ObjectMapper objectMapper;

  @Override
  public SourceFormat format() {
    return SourceFormat.JSONL;
  }

  @Override
  public ExtractionResult extract(SourceContent content, ExtractionOptions options) {
    String textKey = options.jsonlTextKey();
    String[] lines = Utf8.decode(content.bytes(), content.sourceId()).split("\\r?\\n", -1);

    List<Document> documents = new ArrayList<>();
    List<SkippedSource> skipped = new ArrayList<>();

    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].strip();
      if (line.isEmpty()) {
        continue;
      }
      String recordId = content.sourceId() + "#L" + (i + 1);
      try {
        JsonNode node = parseLine(recordId, line);
        JsonNode textNode = node.get(textKey);
        if (textNode == null || !textNode.isTextual() || textNode.asText().isBlank()) {
          log.warn("{}: no '{}' field or empty; record skipped", recordId, textKey);
          skipped.add(
              new SkippedSource(
                  recordId, SkipReason.MISSING_TEXT_FIELD, "No '" + textKey + "' text field"));
          continue;
        }
        documents.add(
            new Document(
                recordId,
                SourceFormat.JSONL,
                textNode.asText(),
                titleOf(node, content.fallbackTitle()),
                urlOf(node, content.url())));
      } catch (ExtractionException e) {
        log.warn("{}: {}; record skipped", recordId, e.getMessage());
        skipped.add(new SkippedSource(recordId, SkipReason.EXTRACTION_FAILED, e.getMessage()));
      }
    }

    log.debug(
        "JSONL {}: {} records extracted, {} skipped",
        content.sourceId(),
        documents.size(),
        skipped.size());
    return new ExtractionResult(documents, skipped);
  }

  // ---- private helpers ----

  private JsonNode parseLine(String recordId, String line) {
    JsonNode node;
    try {
      node = objectMapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new ExtractionException(recordId, "Invalid JSON: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new ExtractionException(recordId, "Line is not a JSON object");
    }
    return node;
  }

  private String titleOf(JsonNode node, String fallback) {
    String title = textField(node, "title");
    if (title == null) {
      title = textField(node, "source");
    }
    return title != null ? title : fallback;
  }

  private String urlOf(JsonNode node, String fallback) {
    String url = textField(node, "url");
    if (url == null) {
      url = textField(node, "source");
    }
    return url != null ? url : fallback;
  }

  private static String textField(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      return null;
    }
    return value.asText().trim();
  }
}
