package com.flamingo.ai.corpusprep.service.extract;

import com.flamingo.ai.corpusprep.exception.ExtractionException;
import com.flamingo.ai.corpusprep.service.model.Document;
import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentExtractor} for PDF documents.
 *
 * <p>Uses Apache PDFBox 3.x to extract text page by page, in page order. Pages are joined with a
 * single line break, which the normalizer turns into a space, so a sentence running across a page
 * boundary stays one sentence.
 *
 * <p>The title comes from the document information dictionary when present.
 */
@Service
@Slf4j
public class PdfDocumentExtractor implements DocumentExtractor {

  @Override
  public SourceFormat format() {
    return SourceFormat.PDF;
  }

  @Override
  public ExtractionResult extract(SourceContent content, ExtractionOptions options) {
    try (PDDocument pdfDoc = Loader.loadPDF(content.bytes())) {
      String text = extractPages(pdfDoc);
      String title = titleOf(pdfDoc, content.fallbackTitle());
      log.debug(
          "PDF {}: {} pages, {} chars",
          content.sourceId(),
          pdfDoc.getNumberOfPages(),
          text.length());
      return ExtractionResult.of(
          new Document(content.sourceId(), SourceFormat.PDF, text, title, content.url()));
    } catch (IOException e) {
      throw new ExtractionException(
          content.sourceId(), "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  // ---- private helpers ----

  private String extractPages(PDDocument pdfDoc) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setSortByPosition(true);
    StringBuilder text = new StringBuilder();
    int pages = pdfDoc.getNumberOfPages();
    for (int page = 1; page <= pages; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      String pageText = stripper.getText(pdfDoc);
      if (pageText == null || pageText.isBlank()) {
        continue;
      }
      if (text.length() > 0) {
        text.append('\n');
      }
      text.append(pageText.strip());
    }
    return text.toString();
  }

  private String titleOf(PDDocument pdfDoc, String fallbackTitle) {
    PDDocumentInformation info = pdfDoc.getDocumentInformation();
    if (info != null && info.getTitle() != null && !info.getTitle().isBlank()) {
      return info.getTitle().trim();
    }
    return fallbackTitle;
  }
}
