package com.flamingo.ai.corpusprep.service.segment;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import opennlp.tools.sentdetect.SentenceModel;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Initializes the {@link SentenceSegmenter} for a run.
 *
 * <p>{@link #initialize(String)} loads the OpenNLP sentence model from the given location and wraps
 * it in an {@link OpenNlpSentenceSegmenter}. If the model is missing or unreadable the run degrades
 * to a {@link HeuristicSentenceSegmenter} and a warning is logged; this is never fatal.
 *
 * <p>Initialization is idempotent: the outcome for a location is cached, so the model is read at
 * most once per process.
 */
@Component
@Slf4j
public class SentenceSegmenterFactory {

  private static final String CLASSPATH_PREFIX = "classpath:";

  private final ResourceLoader resourceLoader = new DefaultResourceLoader();
  private final Map<String, SentenceSegmenter> initialized = new ConcurrentHashMap<>();

  /**
   * Returns the segmenter for the given model location, loading the model on first use.
   *
   * @param modelLocation file system path or {@code classpath:} resource of an OpenNLP sentence
   *     model; {@code null} or blank selects the heuristic segmenter
   * @return a ready segmenter, never {@code null}
   */
  public SentenceSegmenter initialize(String modelLocation) {
    String key = modelLocation == null ? "" : modelLocation.trim();
    return initialized.computeIfAbsent(key, this::load);
  }

  private SentenceSegmenter load(String modelLocation) {
    if (modelLocation.isEmpty()) {
      log.warn("No sentence model configured; using heuristic sentence segmentation");
      return new HeuristicSentenceSegmenter();
    }
    Resource resource = resolve(modelLocation);
    if (!resource.exists()) {
      log.warn(
          "Sentence model not found at {}; falling back to heuristic sentence segmentation",
          modelLocation);
      return new HeuristicSentenceSegmenter();
    }
    try (InputStream in = resource.getInputStream()) {
      SentenceModel model = new SentenceModel(in);
      log.info("Loaded sentence model from {} (language={})", modelLocation, model.getLanguage());
      return new OpenNlpSentenceSegmenter(model);
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Failed to load sentence model from {}: {}; falling back to heuristic sentence"
              + " segmentation",
          modelLocation,
          e.getMessage());
      return new HeuristicSentenceSegmenter();
    }
  }

  private Resource resolve(String modelLocation) {
    if (modelLocation.startsWith(CLASSPATH_PREFIX)) {
      return resourceLoader.getResource(modelLocation);
    }
    return new FileSystemResource(Path.of(modelLocation));
  }
}
