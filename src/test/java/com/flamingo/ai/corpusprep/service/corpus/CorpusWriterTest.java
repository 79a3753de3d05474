package com.flamingo.ai.corpusprep.service.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusprep.exception.OutputWriteException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CorpusWriter Tests")
class CorpusWriterTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @TempDir Path dir;

  @Test
  @DisplayName("should write one compact JSON object per line in field order, omitting null url")
  void shouldWriteJsonLines() throws IOException {
    Path output = dir.resolve("corpus.jsonl");
    CorpusRecord local =
        new CorpusRecord("id-1", "Hello.", "a.txt", "a", "plain_text", null, 0, 1, 1);
    CorpusRecord remote =
        new CorpusRecord("id-2", "Hi.", "https://x.org", "x.org", "html", "https://x.org", 0, 1, 1);

    try (CorpusWriter writer = CorpusWriter.open(output, objectMapper)) {
      writer.write(List.of(local, remote));
      assertThat(writer.getRecordsWritten()).isEqualTo(2);
    }

    List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
    assertThat(lines)
        .containsExactly(
            "{\"id\":\"id-1\",\"text\":\"Hello.\",\"source\":\"a.txt\",\"title\":\"a\","
                + "\"format\":\"plain_text\",\"chunk_index\":0,\"total_chunks\":1,"
                + "\"token_count\":1}",
            "{\"id\":\"id-2\",\"text\":\"Hi.\",\"source\":\"https://x.org\",\"title\":\"x.org\","
                + "\"format\":\"html\",\"url\":\"https://x.org\",\"chunk_index\":0,"
                + "\"total_chunks\":1,\"token_count\":1}");
    assertThat(Files.readString(output)).endsWith("\n");
  }

  @Test
  @DisplayName("should create missing parent directories and truncate an existing file")
  void shouldCreateParentsAndTruncate() throws IOException {
    Path output = dir.resolve("nested/out/corpus.jsonl");
    Files.createDirectories(output.getParent());
    Files.writeString(output, "stale line 1\nstale line 2\nstale line 3\n");

    try (CorpusWriter writer = CorpusWriter.open(output, objectMapper)) {
      writer.write(new CorpusRecord("id", "Fresh.", "a.txt", null, "plain_text", null, 0, 1, 1));
    }

    List<String> lines = Files.readAllLines(output);
    assertThat(lines).hasSize(1);
    assertThat(lines.get(0)).contains("Fresh.");
  }

  @Test
  @DisplayName("should raise OutputWriteException when the output cannot be opened")
  void shouldFail_whenOutputIsDirectory() throws IOException {
    Path output = Files.createDirectories(dir.resolve("corpus.jsonl"));

    assertThatThrownBy(() -> CorpusWriter.open(output, objectMapper))
        .isInstanceOfSatisfying(
            OutputWriteException.class, e -> assertThat(e.getPath()).isEqualTo(output));
  }
}
