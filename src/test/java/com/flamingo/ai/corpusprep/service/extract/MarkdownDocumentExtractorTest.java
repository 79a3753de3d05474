package com.flamingo.ai.corpusprep.service.extract;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.corpusprep.service.model.Document;
import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MarkdownDocumentExtractor Tests")
class MarkdownDocumentExtractorTest {

  private final MarkdownDocumentExtractor extractor = new MarkdownDocumentExtractor();

  @Test
  @DisplayName("should strip markup while keeping heading, link and code text")
  void shouldStripMarkup() {
    String markdown =
        "# Getting Started\n\n"
            + "Some *emphasis* and a [link](https://example.com/page).\n\n"
            + "- first item\n"
            + "- second item\n\n"
            + "```java\nint x = 1;\n```\n\n"
            + "![diagram](img/diagram.png)\n\n"
            + "<div class=\"note\">raw html</div>\n";

    Document document = extract(markdown);

    assertThat(document.rawText())
        .contains("Getting Started")
        .contains("Some emphasis and a link.")
        .contains("first item")
        .contains("second item")
        .contains("int x = 1;")
        .doesNotContain("*")
        .doesNotContain("https://example.com")
        .doesNotContain("diagram")
        .doesNotContain("<div")
        .doesNotContain("```");
  }

  @Test
  @DisplayName("should keep blocks in document order")
  void shouldKeepBlockOrder() {
    Document document = extract("# Title\n\nAlpha paragraph.\n\n## Section\n\nBeta paragraph.\n");

    assertThat(document.rawText())
        .isEqualTo("Title\n\nAlpha paragraph.\n\nSection\n\nBeta paragraph.");
  }

  @Test
  @DisplayName("should use the first level-1 heading as title")
  void shouldUseFirstH1AsTitle() {
    Document document = extract("## Intro\n\nText.\n\n# Real Title\n\n# Second Title\n");

    assertThat(document.title()).isEqualTo("Real Title");
  }

  @Test
  @DisplayName("should fall back to the file stem when there is no level-1 heading")
  void shouldFallBackToStem_whenNoH1() {
    Document document = extract("## Only a subheading\n\nText.\n");

    assertThat(document.title()).isEqualTo("guide");
  }

  private Document extract(String markdown) {
    SourceContent content =
        new SourceContent(
            "docs/guide.md",
            SourceFormat.MARKDOWN,
            markdown.getBytes(StandardCharsets.UTF_8),
            "guide",
            null);
    return extractor.extract(content, new ExtractionOptions(null)).documents().get(0);
  }
}
