package com.flamingo.ai.corpusprep.service.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExtractorRegistry Tests")
class ExtractorRegistryTest {

  @Test
  @DisplayName("should route every format to its extractor")
  void shouldRouteEveryFormat() {
    ExtractorRegistry registry =
        new ExtractorRegistry(
            List.of(
                new HtmlDocumentExtractor(),
                new PdfDocumentExtractor(),
                new MarkdownDocumentExtractor(),
                new PlainTextDocumentExtractor(),
                new JsonlDocumentExtractor(new ObjectMapper())));

    for (SourceFormat format : SourceFormat.values()) {
      assertThat(registry.route(format).format()).isEqualTo(format);
    }
  }

  @Test
  @DisplayName("should fail when a format has no extractor")
  void shouldFail_whenFormatUnregistered() {
    ExtractorRegistry registry = new ExtractorRegistry(List.of(new PlainTextDocumentExtractor()));

    assertThatThrownBy(() -> registry.route(SourceFormat.PDF))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("PDF");
  }

  @Test
  @DisplayName("should reject two extractors for the same format")
  void shouldRejectDuplicateExtractors() {
    List<DocumentExtractor> extractors =
        List.of(new PlainTextDocumentExtractor(), new PlainTextDocumentExtractor());

    assertThatThrownBy(() -> new ExtractorRegistry(extractors))
        .isInstanceOf(IllegalStateException.class);
  }
}
