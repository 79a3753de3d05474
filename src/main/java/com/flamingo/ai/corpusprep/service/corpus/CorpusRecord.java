package com.flamingo.ai.corpusprep.service.corpus;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flamingo.ai.corpusprep.service.model.Chunk;
import com.flamingo.ai.corpusprep.service.model.Document;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * One line of the output corpus.
 *
 * @param id name-based UUID of {@code source + "#" + chunkIndex}; stable across runs
 * @param text chunk sentences joined with single spaces
 * @param source source id of the document
 * @param title document title, omitted when unknown
 * @param format source format tag
 * @param url origin URL, omitted for local sources
 * @param chunkIndex 0-based chunk position within the document
 * @param totalChunks number of chunks emitted for the document
 * @param tokenCount estimated token count of the chunk
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "id",
  "text",
  "source",
  "title",
  "format",
  "url",
  "chunk_index",
  "total_chunks",
  "token_count"
})
public record CorpusRecord(
    String id,
    String text,
    String source,
    String title,
    String format,
    String url,
    @JsonProperty("chunk_index") int chunkIndex,
    @JsonProperty("total_chunks") int totalChunks,
    @JsonProperty("token_count") int tokenCount) {

  /** Deterministic record id for a chunk position of a source. */
  public static String idFor(String sourceId, int chunkIndex) {
    return UUID.nameUUIDFromBytes((sourceId + "#" + chunkIndex).getBytes(StandardCharsets.UTF_8))
        .toString();
  }

  /**
   * Builds the records of one fully chunked document, back-filling {@code totalChunks}.
   *
   * @param document the document the chunks came from
   * @param chunks all chunks of the document in emission order
   * @return one record per chunk
   */
  public static List<CorpusRecord> forDocument(Document document, List<Chunk> chunks) {
    List<CorpusRecord> records = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      records.add(
          new CorpusRecord(
              idFor(document.sourceId(), chunk.chunkIndex()),
              chunk.text(),
              document.sourceId(),
              document.title(),
              document.format().name().toLowerCase(Locale.ROOT),
              document.url(),
              chunk.chunkIndex(),
              chunks.size(),
              chunk.tokenCount()));
    }
    return records;
  }
}
