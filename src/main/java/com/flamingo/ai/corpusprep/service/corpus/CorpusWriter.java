package com.flamingo.ai.corpusprep.service.corpus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusprep.exception.OutputWriteException;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends {@link CorpusRecord}s to a JSON Lines file, one compact JSON object per line.
 *
 * <p>The file is truncated when the writer opens it, so rerunning with the same output path
 * replaces the previous corpus. Only one thread may write; the pipeline hands every record to a
 * single writer in source order. Any I/O failure raises {@link OutputWriteException}.
 */
@Slf4j
public class CorpusWriter implements AutoCloseable {

  private final Path path;
  private final ObjectMapper objectMapper;
  private final BufferedWriter writer;
  private long recordsWritten;

  private CorpusWriter(Path path, ObjectMapper objectMapper, BufferedWriter writer) {
    this.path = path;
    this.objectMapper = objectMapper;
    this.writer = writer;
  }

  /**
   * Opens (creating or truncating) the output file, creating missing parent directories.
   *
   * @throws OutputWriteException if the file cannot be opened for writing
   */
  public static CorpusWriter open(Path path, ObjectMapper objectMapper) {
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      BufferedWriter writer =
          Files.newBufferedWriter(
              path,
              StandardCharsets.UTF_8,
              StandardOpenOption.CREATE,
              StandardOpenOption.TRUNCATE_EXISTING,
              StandardOpenOption.WRITE);
      log.debug("Opened corpus output {}", path);
      return new CorpusWriter(path, objectMapper, writer);
    } catch (IOException e) {
      throw new OutputWriteException(
          path, "Cannot open corpus output " + path + ": " + e.getMessage(), e);
    }
  }

  /** Appends one record. */
  public void write(CorpusRecord record) {
    try {
      writer.write(objectMapper.writeValueAsString(record));
      writer.write('\n');
      recordsWritten++;
    } catch (JsonProcessingException e) {
      throw new OutputWriteException(path, "Cannot serialize record " + record.id(), e);
    } catch (IOException e) {
      throw new OutputWriteException(
          path, "Cannot write corpus output " + path + ": " + e.getMessage(), e);
    }
  }

  /** Appends the records of one document in order. */
  public void write(List<CorpusRecord> records) {
    for (CorpusRecord record : records) {
      write(record);
    }
  }

  public long getRecordsWritten() {
    return recordsWritten;
  }

  @Override
  public void close() {
    try {
      writer.close();
    } catch (IOException e) {
      throw new OutputWriteException(
          path, "Cannot close corpus output " + path + ": " + e.getMessage(), e);
    }
  }
}
