package com.flamingo.ai.corpusprep.service.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusprep.config.WorkerExecutorFactory;
import com.flamingo.ai.corpusprep.exception.ExtractionException;
import com.flamingo.ai.corpusprep.exception.NetworkFetchException;
import com.flamingo.ai.corpusprep.exception.UnsupportedFormatException;
import com.flamingo.ai.corpusprep.service.chunk.ChunkingParams;
import com.flamingo.ai.corpusprep.service.chunk.SentenceWindowChunker;
import com.flamingo.ai.corpusprep.service.corpus.ChunkFileWriter;
import com.flamingo.ai.corpusprep.service.corpus.CorpusRecord;
import com.flamingo.ai.corpusprep.service.corpus.CorpusWriter;
import com.flamingo.ai.corpusprep.service.extract.ExtractionOptions;
import com.flamingo.ai.corpusprep.service.extract.ExtractionResult;
import com.flamingo.ai.corpusprep.service.extract.ExtractorRegistry;
import com.flamingo.ai.corpusprep.service.extract.SourceContent;
import com.flamingo.ai.corpusprep.service.model.Chunk;
import com.flamingo.ai.corpusprep.service.model.Document;
import com.flamingo.ai.corpusprep.service.model.SkipReason;
import com.flamingo.ai.corpusprep.service.model.SkippedSource;
import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import com.flamingo.ai.corpusprep.service.segment.SentenceSegmenter;
import com.flamingo.ai.corpusprep.service.segment.SentenceSegmenterFactory;
import com.flamingo.ai.corpusprep.service.source.FetchedResource;
import com.flamingo.ai.corpusprep.service.source.ResolvedInput;
import com.flamingo.ai.corpusprep.service.source.SourceRef;
import com.flamingo.ai.corpusprep.service.source.SourceResolver;
import com.flamingo.ai.corpusprep.service.source.UrlFetcher;
import com.flamingo.ai.corpusprep.service.text.TextNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs the corpus preparation pipeline: resolve, read or fetch, extract, normalize, segment, chunk
 * and write.
 *
 * <p>Sources are extracted and chunked on a pool of {@code workers} threads, but every record is
 * written by the calling thread in source order, so the corpus is byte-identical for any worker
 * count. Failures of a single source are logged, recorded as {@link SkippedSource} and do not stop
 * the run. Failures to write the output propagate as {@link
 * com.flamingo.ai.corpusprep.exception.OutputWriteException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorpusPipeline {

  private final SourceResolver sourceResolver;
  private final UrlFetcher urlFetcher;
  private final ExtractorRegistry extractorRegistry;
  private final TextNormalizer textNormalizer;
  private final SentenceSegmenterFactory segmenterFactory;
  private final SentenceWindowChunker chunker;
  private final WorkerExecutorFactory workerExecutorFactory;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the pipeline once.
   *
   * @param options run settings
   * @return counts and skipped sources of the run
   * @throws IllegalArgumentException if the chunking settings or worker count are invalid
   * @throws com.flamingo.ai.corpusprep.exception.OutputWriteException if the corpus or a chunk
   *     file cannot be written
   */
  public RunSummary run(PipelineOptions options) {
    ChunkingParams params =
        new ChunkingParams(
            options.maxTokens(),
            options.overlapSentences(),
            options.tokenEstimator().create(options.tokensPerWord()));
    if (options.workers() < 1) {
      throw new IllegalArgumentException("workers must be at least 1: " + options.workers());
    }
    ExtractionOptions extractionOptions = new ExtractionOptions(options.jsonlKey());
    SentenceSegmenter segmenter = segmenterFactory.initialize(options.sentenceModel());
    log.info(
        "Preparing corpus {} from {} input(s): maxTokens={}, overlapSentences={}, estimator={},"
            + " segmentation={}",
        options.output(),
        options.sources().size(),
        params.maxTokens(),
        params.overlapSentences(),
        options.tokenEstimator(),
        segmenter.mode());

    List<SkippedSource> skipped = new ArrayList<>();
    int documents = 0;
    int chunks = 0;
    long records;

    try (CorpusWriter writer = CorpusWriter.open(options.output(), objectMapper)) {
      ChunkFileWriter chunkFiles =
          options.chunksDir() != null ? new ChunkFileWriter(options.chunksDir()) : null;
      List<SourceRef> sources = resolveAll(options.sources(), skipped);

      for (SourceResult result :
          processAll(sources, options.workers(), params, extractionOptions, segmenter)) {
        for (ProcessedDocument processed : result.documents()) {
          writer.write(CorpusRecord.forDocument(processed.document(), processed.chunks()));
          if (chunkFiles != null) {
            chunkFiles.write(processed.document(), processed.chunks());
          }
          documents++;
          chunks += processed.chunks().size();
          meterRegistry
              .counter(
                  "corpus.documents",
                  "format",
                  processed.document().format().name().toLowerCase(Locale.ROOT))
              .increment();
          meterRegistry.counter("corpus.chunks").increment(processed.chunks().size());
        }
        result.skipped().forEach(skip -> recordSkip(skip, skipped));
      }
      records = writer.getRecordsWritten();
      if (chunkFiles != null) {
        log.info("Wrote {} chunk file(s) to {}", chunkFiles.getFilesWritten(), options.chunksDir());
      }
    }

    RunSummary summary =
        new RunSummary(options.output(), documents, chunks, records, skipped, segmenter.mode());
    logSummary(summary);
    return summary;
  }

  // ---- source resolution ----

  private List<SourceRef> resolveAll(List<String> inputs, List<SkippedSource> skipped) {
    List<SourceRef> sources = new ArrayList<>();
    for (String input : inputs) {
      try {
        ResolvedInput resolved = sourceResolver.resolve(input);
        sources.addAll(resolved.sources());
        resolved.skipped().forEach(skip -> recordSkip(skip, skipped));
      } catch (UncheckedIOException e) {
        log.warn("Cannot read input {}: {}", input, e.getMessage());
        recordSkip(new SkippedSource(input, SkipReason.NOT_FOUND, e.getMessage()), skipped);
      }
    }
    log.debug("Resolved {} source(s)", sources.size());
    return sources;
  }

  private void recordSkip(SkippedSource skip, List<SkippedSource> skipped) {
    skipped.add(skip);
    meterRegistry.counter("corpus.skipped", "reason", skip.reason().name()).increment();
  }

  // ---- per-source processing ----

  private List<SourceResult> processAll(
      List<SourceRef> sources,
      int workers,
      ChunkingParams params,
      ExtractionOptions extractionOptions,
      SentenceSegmenter segmenter) {
    if (workers == 1 || sources.size() <= 1) {
      List<SourceResult> results = new ArrayList<>(sources.size());
      for (SourceRef source : sources) {
        results.add(timedProcess(source, params, extractionOptions, segmenter));
      }
      return results;
    }

    ThreadPoolTaskExecutor executor = workerExecutorFactory.create(workers);
    try {
      List<CompletableFuture<SourceResult>> futures = new ArrayList<>(sources.size());
      for (SourceRef source : sources) {
        futures.add(
            CompletableFuture.supplyAsync(
                () -> timedProcess(source, params, extractionOptions, segmenter), executor));
      }
      List<SourceResult> results = new ArrayList<>(futures.size());
      for (CompletableFuture<SourceResult> future : futures) {
        results.add(future.join());
      }
      return results;
    } finally {
      executor.shutdown();
    }
  }

  private SourceResult timedProcess(
      SourceRef source,
      ChunkingParams params,
      ExtractionOptions extractionOptions,
      SentenceSegmenter segmenter) {
    return meterRegistry
        .timer("corpus.source.process")
        .record(() -> process(source, params, extractionOptions, segmenter));
  }

  SourceResult process(
      SourceRef source,
      ChunkingParams params,
      ExtractionOptions extractionOptions,
      SentenceSegmenter segmenter) {
    String sourceId = source.sourceId();
    try {
      SourceContent content = read(source);
      ExtractionResult extracted =
          extractorRegistry.route(content.format()).extract(content, extractionOptions);

      List<ProcessedDocument> documents = new ArrayList<>();
      List<SkippedSource> skipped = new ArrayList<>(extracted.skipped());
      for (Document document : extracted.documents()) {
        ProcessedDocument processed = chunkDocument(document, params, segmenter);
        if (processed.chunks().isEmpty()) {
          log.warn("Skipping {}: no text content", document.sourceId());
          skipped.add(
              new SkippedSource(document.sourceId(), SkipReason.EMPTY_CONTENT, "No text content"));
        } else {
          documents.add(processed);
        }
      }
      log.info(
          "Processed {} ({}): {} document(s), {} chunk(s)",
          sourceId,
          content.format(),
          documents.size(),
          documents.stream().mapToInt(processed -> processed.chunks().size()).sum());
      return new SourceResult(sourceId, documents, skipped);
    } catch (UnsupportedFormatException e) {
      log.warn("Skipping {}: {}", sourceId, e.getMessage());
      return SourceResult.skipped(sourceId, SkipReason.UNSUPPORTED_FORMAT, e.getMessage());
    } catch (NoSuchFileException e) {
      log.warn("Skipping {}: file not found", sourceId);
      return SourceResult.skipped(sourceId, SkipReason.NOT_FOUND, "File not found: " + e.getFile());
    } catch (IOException e) {
      log.warn("Skipping {}: cannot read file: {}", sourceId, e.getMessage());
      return SourceResult.skipped(sourceId, SkipReason.EXTRACTION_FAILED, e.getMessage());
    } catch (ExtractionException e) {
      log.warn("Skipping {}: {}", sourceId, e.getMessage());
      return SourceResult.skipped(sourceId, SkipReason.EXTRACTION_FAILED, e.getMessage());
    } catch (NetworkFetchException e) {
      log.warn("Skipping {}: {}", sourceId, e.getMessage());
      return SourceResult.skipped(sourceId, SkipReason.FETCH_FAILED, e.getMessage());
    } catch (RuntimeException e) {
      log.error("Unexpected failure while processing {}", sourceId, e);
      return SourceResult.skipped(sourceId, SkipReason.UNEXPECTED_ERROR, String.valueOf(e));
    }
  }

  private SourceContent read(SourceRef source) throws IOException {
    if (source.isRemote()) {
      FetchedResource resource = urlFetcher.fetch(source.url());
      SourceFormat format = sourceResolver.formatOf(resource);
      return new SourceContent(
          source.sourceId(),
          format,
          resource.body(),
          sourceResolver.fallbackTitle(source),
          source.url(),
          resource.contentType());
    }
    if (!Files.exists(source.path())) {
      throw new NoSuchFileException(source.path().toString());
    }
    SourceFormat format = sourceResolver.formatOf(source);
    return new SourceContent(
        source.sourceId(),
        format,
        Files.readAllBytes(source.path()),
        sourceResolver.fallbackTitle(source),
        null);
  }

  private ProcessedDocument chunkDocument(
      Document document, ChunkingParams params, SentenceSegmenter segmenter) {
    String text = textNormalizer.normalize(document.rawText());
    List<String> sentences = segmenter.segment(text);
    List<Chunk> chunks = chunker.chunk(document.sourceId(), sentences, params);
    log.debug(
        "{}: {} chars, {} sentences, {} chunks",
        document.sourceId(),
        text.length(),
        sentences.size(),
        chunks.size());
    return new ProcessedDocument(document.withText(text), chunks);
  }

  private void logSummary(RunSummary summary) {
    log.info(
        "Corpus written to {}: {} document(s), {} chunk(s), {} record(s), {} skipped,"
            + " segmentation={}",
        summary.output(),
        summary.documents(),
        summary.chunks(),
        summary.records(),
        summary.skipped().size(),
        summary.segmentationMode());
    for (SkippedSource skip : summary.skipped()) {
      log.info("  skipped {} [{}]: {}", skip.source(), skip.reason(), skip.detail());
    }
  }
}
