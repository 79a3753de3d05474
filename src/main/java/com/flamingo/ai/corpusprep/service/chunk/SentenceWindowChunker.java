package com.flamingo.ai.corpusprep.service.chunk;

import com.flamingo.ai.corpusprep.service.model.Chunk;
import com.flamingo.ai.corpusprep.service.model.Sentence;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups the sentences of one document into token-budgeted chunks with sentence overlap.
 *
 * <p>Sentences are added to a buffer while the buffer's estimated token count stays within {@code
 * maxTokens}. When the next sentence would push it over, the buffer is emitted and a new one is
 * seeded with the last {@code overlapSentences} sentences of the emitted chunk. Overlap sentences
 * count toward the new chunk's budget: if the overlap plus the pending sentence does not fit, the
 * oldest overlap sentences are dropped until it does.
 *
 * <p>Sentences are never split. A sentence that alone exceeds the budget becomes a one-sentence
 * chunk of its own (after the current buffer is emitted) and the following chunk starts without
 * overlap.
 *
 * <p>Stateless and safe for concurrent use.
 */
@Component
@Slf4j
public class SentenceWindowChunker {

  /**
   * Estimates a token count for every sentence.
   *
   * @param sentences sentence texts in document order
   * @param estimator token estimator of the run
   * @return indexed sentences
   */
  public List<Sentence> toSentences(List<String> sentences, TokenEstimator estimator) {
    List<Sentence> result = new ArrayList<>(sentences.size());
    for (int i = 0; i < sentences.size(); i++) {
      String text = sentences.get(i);
      result.add(new Sentence(i, text, estimator.estimate(text)));
    }
    return result;
  }

  /**
   * Chunks the sentences of one document.
   *
   * @param sourceId id of the document, copied into every chunk
   * @param sentences sentence texts in document order
   * @param params budget, overlap and token estimator
   * @return chunks in emission order, indexed from 0; empty when there are no sentences
   */
  public List<Chunk> chunk(String sourceId, List<String> sentences, ChunkingParams params) {
    return chunkSentences(sourceId, toSentences(sentences, params.tokenEstimator()), params);
  }

  List<Chunk> chunkSentences(String sourceId, List<Sentence> sentences, ChunkingParams params) {
    int maxTokens = params.maxTokens();
    List<Chunk> chunks = new ArrayList<>();
    List<Sentence> buffer = new ArrayList<>();
    int bufferTokens = 0;

    for (Sentence sentence : sentences) {
      if (sentence.tokenCount() > maxTokens) {
        if (!buffer.isEmpty()) {
          chunks.add(emit(sourceId, chunks.size(), buffer, bufferTokens));
          buffer = new ArrayList<>();
          bufferTokens = 0;
        }
        log.info(
            "Sentence {} of {} has ~{} tokens, over the budget of {}; emitting it as its own"
                + " chunk",
            sentence.index(),
            sourceId,
            sentence.tokenCount(),
            maxTokens);
        chunks.add(emit(sourceId, chunks.size(), List.of(sentence), sentence.tokenCount()));
        continue;
      }

      if (bufferTokens + sentence.tokenCount() > maxTokens && !buffer.isEmpty()) {
        Chunk closed = emit(sourceId, chunks.size(), buffer, bufferTokens);
        chunks.add(closed);
        buffer = overlapSeed(closed.sentences(), params.overlapSentences());
        bufferTokens = sumTokens(buffer);
        while (!buffer.isEmpty() && bufferTokens + sentence.tokenCount() > maxTokens) {
          bufferTokens -= buffer.remove(0).tokenCount();
        }
      }

      buffer.add(sentence);
      bufferTokens += sentence.tokenCount();
    }

    if (!buffer.isEmpty()) {
      chunks.add(emit(sourceId, chunks.size(), buffer, bufferTokens));
    }
    return chunks;
  }

  private List<Sentence> overlapSeed(List<Sentence> closed, int overlapSentences) {
    if (overlapSentences <= 0) {
      return new ArrayList<>();
    }
    int from = Math.max(0, closed.size() - overlapSentences);
    return new ArrayList<>(closed.subList(from, closed.size()));
  }

  private static Chunk emit(String sourceId, int index, List<Sentence> buffer, int tokens) {
    return new Chunk(sourceId, index, buffer, tokens);
  }

  private static int sumTokens(List<Sentence> sentences) {
    int total = 0;
    for (Sentence sentence : sentences) {
      total += sentence.tokenCount();
    }
    return total;
  }
}
