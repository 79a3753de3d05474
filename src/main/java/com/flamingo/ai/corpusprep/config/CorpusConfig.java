package com.flamingo.ai.corpusprep.config;

import com.flamingo.ai.corpusprep.service.chunk.TokenEstimatorType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the corpus preparation pipeline. */
@Configuration
@ConfigurationProperties(prefix = "corpus")
@Getter
@Setter
public class CorpusConfig {

  private Chunking chunking = new Chunking();
  private Segmentation segmentation = new Segmentation();
  private Fetch fetch = new Fetch();
  private Jsonl jsonl = new Jsonl();
  private Pipeline pipeline = new Pipeline();

  @Getter
  @Setter
  public static class Chunking {
    private int maxTokens = 500;
    private int overlapSentences = 2;

    /** How sentence token counts are estimated: "words" (default) or "characters". */
    private TokenEstimatorType tokenEstimator = TokenEstimatorType.WORDS;

    /** Multiplier applied to the word count by the "words" estimator. */
    private double tokensPerWord = 1.0;
  }

  @Getter
  @Setter
  public static class Segmentation {
    /**
     * Location of the OpenNLP sentence model, either a file system path or a {@code classpath:}
     * resource. No model is bundled, so the default is blank and runs use the heuristic segmenter
     * until one is configured. A model that cannot be loaded also falls back to the heuristic.
     */
    private String modelPath = "";
  }

  /** Settings for fetching URL sources. */
  @Getter
  @Setter
  public static class Fetch {
    private int timeoutMs = 15000;
    private int maxAttempts = 3;
    private long initialBackoffMs = 500;
    private double backoffMultiplier = 2.0;
    private int maxResponseBytes = 20 * 1024 * 1024; // 20 MB
    private String userAgent = "corpus-prep/0.1";
  }

  @Getter
  @Setter
  public static class Jsonl {
    /** Field holding the text of each record in {@code .jsonl} sources. */
    private String textKey = "text";
  }

  @Getter
  @Setter
  public static class Pipeline {
    /** Number of sources extracted and chunked concurrently; 1 processes them sequentially. */
    private int workers = 1;
  }
}
