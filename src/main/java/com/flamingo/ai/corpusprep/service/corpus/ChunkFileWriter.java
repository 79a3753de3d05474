package com.flamingo.ai.corpusprep.service.corpus;

import com.flamingo.ai.corpusprep.exception.OutputWriteException;
import com.flamingo.ai.corpusprep.service.model.Chunk;
import com.flamingo.ai.corpusprep.service.model.Document;
import com.flamingo.ai.corpusprep.service.source.SourceResolver;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Exports every chunk as a standalone Markdown file under a root directory.
 *
 * <p>Files mirror the relative directory of their source. A document that produced one chunk is
 * written to {@code <stem>.md}; otherwise chunks go to {@code <stem>_1.md}, {@code <stem>_2.md} and
 * so on. JSONL records use {@code <stem>_L<line>} as their stem and URL sources use their host
 * with dots replaced by underscores.
 */
@Slf4j
public class ChunkFileWriter {

  private static final Pattern JSONL_RECORD_ID = Pattern.compile("^(.*)#L(\\d+)$");

  private final Path root;
  private long filesWritten;

  public ChunkFileWriter(Path root) {
    this.root = root;
  }

  /**
   * Writes the chunks of one document.
   *
   * @throws OutputWriteException if a file cannot be written
   */
  public void write(Document document, List<Chunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    String base = baseNameOf(document.sourceId());
    for (Chunk chunk : chunks) {
      String name =
          chunks.size() > 1 ? base + "_" + (chunk.chunkIndex() + 1) + ".md" : base + ".md";
      Path target = root.resolve(name);
      try {
        Path parent = target.getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        Files.writeString(target, chunk.text(), StandardCharsets.UTF_8);
        filesWritten++;
        log.debug("{} -> {}", document.sourceId(), root.relativize(target));
      } catch (IOException e) {
        throw new OutputWriteException(
            target, "Cannot write chunk file " + target + ": " + e.getMessage(), e);
      }
    }
  }

  public long getFilesWritten() {
    return filesWritten;
  }

  /** Relative path, without extension, that the chunk files of a source share. */
  static String baseNameOf(String sourceId) {
    if (SourceResolver.isUrl(sourceId)) {
      String host = SourceResolver.hostOf(sourceId.trim());
      return (host != null ? host : "remote").replace('.', '_');
    }
    Matcher record = JSONL_RECORD_ID.matcher(sourceId);
    if (record.matches()) {
      return stripExtension(record.group(1)) + "_L" + record.group(2);
    }
    return stripExtension(sourceId);
  }

  private static String stripExtension(String relativePath) {
    int slash = relativePath.lastIndexOf('/');
    int dot = relativePath.lastIndexOf('.');
    return dot > slash + 1 ? relativePath.substring(0, dot) : relativePath;
  }
}
