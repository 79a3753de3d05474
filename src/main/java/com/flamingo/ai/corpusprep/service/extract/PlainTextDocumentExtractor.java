package com.flamingo.ai.corpusprep.service.extract;

import com.flamingo.ai.corpusprep.service.model.Document;
import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import org.springframework.stereotype.Service;

/** {@link DocumentExtractor} for {@code .txt} files: the decoded text is passed through as is. */
@Service
public class PlainTextDocumentExtractor implements DocumentExtractor {

  @Override
  public SourceFormat format() {
    return SourceFormat.PLAIN_TEXT;
  }

  @Override
  public ExtractionResult extract(SourceContent content, ExtractionOptions options) {
    String text = Utf8.decode(content.bytes(), content.sourceId());
    return ExtractionResult.of(
        new Document(
            content.sourceId(),
            SourceFormat.PLAIN_TEXT,
            text,
            content.fallbackTitle(),
            content.url()));
  }
}
