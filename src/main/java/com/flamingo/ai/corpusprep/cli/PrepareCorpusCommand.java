package com.flamingo.ai.corpusprep.cli;

import com.flamingo.ai.corpusprep.config.CorpusConfig;
import com.flamingo.ai.corpusprep.exception.OutputWriteException;
import com.flamingo.ai.corpusprep.service.chunk.TokenEstimatorType;
import com.flamingo.ai.corpusprep.service.pipeline.CorpusPipeline;
import com.flamingo.ai.corpusprep.service.pipeline.PipelineOptions;
import com.flamingo.ai.corpusprep.service.pipeline.RunSummary;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command-line entry point: prepares a JSON Lines corpus from directories, files and URLs.
 *
 * <p>Options left out on the command line take their value from {@code corpus.*} in {@code
 * application.yml}. Exit status is 0 when the run completes (skipped sources included), 1 when the
 * output cannot be written or no document was found, and 2 for usage errors.
 */
@Component
@Command(
    name = "corpus-prep",
    description = "Extract, normalize and chunk documents into a JSON Lines corpus for RAG",
    mixinStandardHelpOptions = true,
    version = "corpus-prep 0.1.0",
    sortOptions = false)
@Slf4j
public class PrepareCorpusCommand implements Callable<Integer> {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;

  private final CorpusPipeline corpusPipeline;
  private final CorpusConfig corpusConfig;

  @Spec private CommandSpec spec;

  @Parameters(
      arity = "2..*",
      paramLabel = "SOURCE... OUTPUT",
      description =
          "One or more directories, files (.html, .htm, .pdf, .md, .markdown, .txt, .jsonl) or"
              + " http(s) URLs, followed by the output .jsonl file")
  private List<String> paths;

  @Option(
      names = {"--max-tokens"},
      description = "Token budget per chunk (default: corpus.chunking.max-tokens)")
  private Integer maxTokens;

  @Option(
      names = {"--overlap-sentences"},
      description =
          "Sentences repeated between chunks (default: corpus.chunking.overlap-sentences)")
  private Integer overlapSentences;

  @Option(
      names = {"--jsonl-key"},
      description = "Field holding the text of JSONL records (default: corpus.jsonl.text-key)")
  private String jsonlKey;

  @Option(
      names = {"--token-estimator"},
      description = "Token estimation: ${COMPLETION-CANDIDATES}")
  private TokenEstimatorType tokenEstimator;

  @Option(
      names = {"--chunks-dir"},
      description = "Also write every chunk as a Markdown file under this directory")
  private Path chunksDir;

  @Option(
      names = {"--workers"},
      description = "Sources processed in parallel (default: corpus.pipeline.workers)")
  private Integer workers;

  @Option(
      names = {"--sentence-model"},
      description = "OpenNLP sentence model, file path or classpath: resource")
  private String sentenceModel;

  public PrepareCorpusCommand(CorpusPipeline corpusPipeline, CorpusConfig corpusConfig) {
    this.corpusPipeline = corpusPipeline;
    this.corpusConfig = corpusConfig;
  }

  @Override
  public Integer call() {
    PipelineOptions options = buildOptions();
    RunSummary summary;
    try {
      summary = corpusPipeline.run(options);
    } catch (IllegalArgumentException e) {
      throw new ParameterException(spec.commandLine(), e.getMessage(), e);
    } catch (OutputWriteException e) {
      log.error("Cannot write output {}: {}", e.getPath(), e.getMessage());
      return EXIT_FAILED;
    }
    if (!summary.hasDocuments()) {
      log.error("No documents found in {}", options.sources());
      return EXIT_FAILED;
    }
    return EXIT_OK;
  }

  PipelineOptions buildOptions() {
    List<String> sources = paths.subList(0, paths.size() - 1);
    Path output = Path.of(paths.get(paths.size() - 1));
    CorpusConfig.Chunking chunking = corpusConfig.getChunking();

    int budget = maxTokens != null ? maxTokens : chunking.getMaxTokens();
    int overlap = overlapSentences != null ? overlapSentences : chunking.getOverlapSentences();
    int workerCount = workers != null ? workers : corpusConfig.getPipeline().getWorkers();
    if (budget < 1) {
      throw new ParameterException(spec.commandLine(), "--max-tokens must be at least 1");
    }
    if (overlap < 0) {
      throw new ParameterException(spec.commandLine(), "--overlap-sentences must not be negative");
    }
    if (workerCount < 1) {
      throw new ParameterException(spec.commandLine(), "--workers must be at least 1");
    }

    return new PipelineOptions(
        sources,
        output,
        budget,
        overlap,
        jsonlKey != null ? jsonlKey : corpusConfig.getJsonl().getTextKey(),
        tokenEstimator != null ? tokenEstimator : chunking.getTokenEstimator(),
        chunking.getTokensPerWord(),
        chunksDir,
        workerCount,
        sentenceModel != null ? sentenceModel : corpusConfig.getSegmentation().getModelPath());
  }
}
