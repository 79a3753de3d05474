package com.flamingo.ai.corpusprep.service.extract;

import com.flamingo.ai.corpusprep.service.model.Document;
import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentExtractor} for Markdown files ({@code .md}, {@code .markdown}).
 *
 * <p>Uses {@code commonmark-java} to parse the Markdown AST and keeps only the underlying text:
 *
 * <ul>
 *   <li>{@link Heading} and {@link Paragraph} nodes (including those inside lists and block quotes)
 *       become blocks of plain text; emphasis and link markup are dropped, link text is kept
 *   <li>{@link FencedCodeBlock} and {@link IndentedCodeBlock} contribute their literal content
 *   <li>raw HTML and images are ignored
 * </ul>
 *
 * <p>The first level-1 heading becomes the document title.
 */
@Service
@Slf4j
public class MarkdownDocumentExtractor implements DocumentExtractor {

  private static final Parser PARSER = Parser.builder().build();

  @Override
  public SourceFormat format() {
    return SourceFormat.MARKDOWN;
  }

  @Override
  public ExtractionResult extract(SourceContent content, ExtractionOptions options) {
    String markdown = Utf8.decode(content.bytes(), content.sourceId());
    Node root = PARSER.parse(markdown);

    PlainTextVisitor visitor = new PlainTextVisitor();
    root.accept(visitor);

    String title = visitor.title != null ? visitor.title : content.fallbackTitle();
    log.debug(
        "Markdown {}: {} chars of text, title={}", content.sourceId(), visitor.length(), title);
    return ExtractionResult.of(
        new Document(
            content.sourceId(), SourceFormat.MARKDOWN, visitor.text(), title, content.url()));
  }

  // ---- inner visitor ----

  private static final class PlainTextVisitor extends AbstractVisitor {

    private final StringBuilder text = new StringBuilder();
    private String title;

    @Override
    public void visit(Heading heading) {
      String headingText = extractText(heading);
      if (title == null && heading.getLevel() == 1 && !headingText.isBlank()) {
        title = headingText;
      }
      appendBlock(headingText);
    }

    @Override
    public void visit(Paragraph paragraph) {
      appendBlock(extractText(paragraph));
    }

    @Override
    public void visit(FencedCodeBlock codeBlock) {
      appendBlock(codeBlock.getLiteral());
    }

    @Override
    public void visit(IndentedCodeBlock codeBlock) {
      appendBlock(codeBlock.getLiteral());
    }

    @Override
    public void visit(HtmlBlock htmlBlock) {
      // markup only
    }

    String text() {
      return text.toString();
    }

    int length() {
      return text.length();
    }

    private void appendBlock(String block) {
      if (block == null || block.isBlank()) {
        return;
      }
      if (text.length() > 0) {
        text.append("\n\n");
      }
      text.append(block.trim());
    }

    private String extractText(Node node) {
      StringBuilder sb = new StringBuilder();
      collectNodeText(node, sb);
      return sb.toString().trim();
    }

    private void collectNodeText(Node node, StringBuilder sb) {
      if (node instanceof Text textNode) {
        sb.append(textNode.getLiteral());
      } else if (node instanceof Code code) {
        sb.append(code.getLiteral());
      } else if (node instanceof SoftLineBreak) {
        sb.append(" ");
      } else if (node instanceof HardLineBreak) {
        sb.append("\n");
      } else if (node instanceof Image || node instanceof HtmlInline) {
        return;
      } else {
        Node child = node.getFirstChild();
        while (child != null) {
          collectNodeText(child, sb);
          child = child.getNext();
        }
      }
    }
  }
}
