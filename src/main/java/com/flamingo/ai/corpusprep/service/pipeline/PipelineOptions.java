package com.flamingo.ai.corpusprep.service.pipeline;

import com.flamingo.ai.corpusprep.config.CorpusConfig;
import com.flamingo.ai.corpusprep.service.chunk.TokenEstimatorType;
import java.nio.file.Path;
import java.util.List;

/**
 * Settings of one corpus preparation run.
 *
 * @param sources directories, files and URLs, processed in the given order
 * @param output JSON Lines corpus file
 * @param maxTokens token budget per chunk
 * @param overlapSentences sentences repeated between consecutive chunks
 * @param jsonlKey field holding the text of JSONL records
 * @param tokenEstimator token estimation strategy
 * @param tokensPerWord scale factor of the word estimator
 * @param chunksDir directory for per-chunk Markdown files, {@code null} to skip the export
 * @param workers sources processed concurrently
 * @param sentenceModel location of the OpenNLP sentence model
 */
public record PipelineOptions(
    List<String> sources,
    Path output,
    int maxTokens,
    int overlapSentences,
    String jsonlKey,
    TokenEstimatorType tokenEstimator,
    double tokensPerWord,
    Path chunksDir,
    int workers,
    String sentenceModel) {

  public PipelineOptions {
    sources = List.copyOf(sources);
  }

  /** Options for the given sources and output with every other setting taken from config. */
  public static PipelineOptions defaults(List<String> sources, Path output, CorpusConfig config) {
    return new PipelineOptions(
        sources,
        output,
        config.getChunking().getMaxTokens(),
        config.getChunking().getOverlapSentences(),
        config.getJsonl().getTextKey(),
        config.getChunking().getTokenEstimator(),
        config.getChunking().getTokensPerWord(),
        null,
        config.getPipeline().getWorkers(),
        config.getSegmentation().getModelPath());
  }
}
