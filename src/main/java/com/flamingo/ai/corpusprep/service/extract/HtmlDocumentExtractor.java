package com.flamingo.ai.corpusprep.service.extract;

import com.flamingo.ai.corpusprep.exception.ExtractionException;
import com.flamingo.ai.corpusprep.service.model.Document;
import com.flamingo.ai.corpusprep.service.model.SourceFormat;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.html.DefaultHtmlMapper;
import org.apache.tika.parser.html.HtmlMapper;
import org.apache.tika.parser.html.HtmlParser;
import org.springframework.stereotype.Service;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * {@link DocumentExtractor} for HTML pages, both local {@code .html}/{@code .htm} files and fetched
 * URLs.
 *
 * <p>Uses Apache Tika's {@link HtmlParser}, which tolerates malformed markup and emits the page as
 * XHTML SAX events. A custom {@link HtmlMapper} discards {@code <script>} and {@code <style>}
 * content together with page chrome ({@code <nav>}, {@code <header>}, {@code <footer>}, {@code
 * <aside>}), and keeps HTML5 sectioning elements that Tika's default mapping drops. Elements whose
 * {@code class} contains {@code sidebar} or {@code toc} are skipped with their content.
 *
 * <p>When the page has a {@code <main>} element, only the text of the first one is kept; otherwise
 * the first {@code <article>}, otherwise the whole body. Headings are kept as plain text and block
 * elements are separated by line breaks so adjacent blocks do not fuse into one word.
 *
 * <p>The {@code <title>} element becomes the document title. The charset of a fetched page's
 * {@code Content-Type} header is used when the markup does not declare one.
 */
@Service
@Slf4j
public class HtmlDocumentExtractor implements DocumentExtractor {

  private static final String DEFAULT_CHARSET = "UTF-8";

  private static final Set<String> DISCARDED_ELEMENTS =
      Set.of("script", "style", "noscript", "template", "nav", "header", "footer", "aside");

  private static final Set<String> BLOCK_ELEMENTS =
      Set.of(
          "p", "div", "h1", "h2", "h3", "h4", "h5", "h6", "li", "ul", "ol", "dl", "dt", "dd", "pre",
          "blockquote", "table", "tr", "th", "td", "br", "hr", "address", "center", "form",
          "main", "article", "section", "figure", "figcaption", "details", "summary", "dialog");

  /** Elements Tika's default mapping does not emit, but whose boundaries separate text. */
  private static final Set<String> SECTIONING_ELEMENTS =
      Set.of(
          "div", "main", "article", "section", "figure", "figcaption", "details", "summary",
          "dialog");

  private static final Set<String> SKIPPED_CLASSES = Set.of("sidebar", "toc");

  @Override
  public SourceFormat format() {
    return SourceFormat.HTML;
  }

  @Override
  public ExtractionResult extract(SourceContent content, ExtractionOptions options) {
    Metadata metadata = new Metadata();
    String charset = charsetOf(content.contentType());
    metadata.set(Metadata.CONTENT_TYPE, "text/html; charset=" + charset);
    ParseContext context = new ParseContext();
    context.set(HtmlMapper.class, new ReadableTextMapper());
    VisibleTextHandler handler = new VisibleTextHandler();

    try (InputStream in = new ByteArrayInputStream(content.bytes())) {
      new HtmlParser().parse(in, handler, metadata, context);
    } catch (IOException | SAXException | TikaException e) {
      throw new ExtractionException(
          content.sourceId(), "Failed to parse HTML: " + e.getMessage(), e);
    }

    String title = metadata.get(TikaCoreProperties.TITLE);
    if (title == null || title.isBlank()) {
      title = content.fallbackTitle();
    }
    String text = handler.text();
    log.debug(
        "HTML {}: {} chars of visible text, title={}", content.sourceId(), text.length(), title);
    return ExtractionResult.of(
        new Document(content.sourceId(), SourceFormat.HTML, text, title.trim(), content.url()));
  }

  /** Charset parameter of a {@code Content-Type} header, UTF-8 when there is none. */
  static String charsetOf(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return DEFAULT_CHARSET;
    }
    MediaType type = MediaType.parse(contentType);
    String charset = type != null ? type.getParameters().get("charset") : null;
    if (charset == null || !isSupported(charset.trim())) {
      return DEFAULT_CHARSET;
    }
    return Charset.forName(charset.trim()).name();
  }

  private static boolean isSupported(String charset) {
    try {
      return Charset.isSupported(charset);
    } catch (IllegalCharsetNameException e) {
      log.debug("Ignoring invalid charset {}", charset);
      return false;
    }
  }

  // ---- Tika callbacks ----

  /**
   * Keeps Tika's safe element mapping, adds sectioning elements and {@code class} attributes, and
   * drops non-content elements along with their text.
   */
  private static final class ReadableTextMapper implements HtmlMapper {

    @Override
    public String mapSafeElement(String name) {
      String lower = name.toLowerCase(Locale.ROOT);
      if (SECTIONING_ELEMENTS.contains(lower)) {
        return lower;
      }
      return DefaultHtmlMapper.INSTANCE.mapSafeElement(name);
    }

    @Override
    public boolean isDiscardElement(String name) {
      return DISCARDED_ELEMENTS.contains(name.toLowerCase(Locale.ROOT))
          || DefaultHtmlMapper.INSTANCE.isDiscardElement(name);
    }

    @Override
    public String mapSafeAttribute(String elementName, String attributeName) {
      if ("class".equalsIgnoreCase(attributeName)) {
        return "class";
      }
      return DefaultHtmlMapper.INSTANCE.mapSafeAttribute(elementName, attributeName);
    }
  }

  /** Collects the character data of the XHTML body and of its first main and article. */
  private static final class VisibleTextHandler extends DefaultHandler {

    private final StringBuilder body = new StringBuilder();
    private final Region main = new Region("main");
    private final Region article = new Region("article");
    private int headDepth = 0;
    private int skipDepth = 0;

    @Override
    public void startElement(String uri, String localName, String qName, Attributes atts) {
      String name = elementName(localName, qName);
      if ("head".equals(name) || headDepth > 0) {
        headDepth++;
        return;
      }
      if (skipDepth > 0 || hasSkippedClass(atts)) {
        skipDepth++;
        return;
      }
      main.start(name);
      article.start(name);
      if (BLOCK_ELEMENTS.contains(name)) {
        append("\n");
      }
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
      if (headDepth > 0) {
        headDepth--;
        return;
      }
      if (skipDepth > 0) {
        skipDepth--;
        return;
      }
      if (BLOCK_ELEMENTS.contains(elementName(localName, qName))) {
        append("\n");
      }
      main.end();
      article.end();
    }

    @Override
    public void characters(char[] ch, int start, int length) {
      if (headDepth == 0 && skipDepth == 0) {
        append(new String(ch, start, length));
      }
    }

    @Override
    public void ignorableWhitespace(char[] ch, int start, int length) {
      if (headDepth == 0 && skipDepth == 0) {
        append(" ");
      }
    }

    String text() {
      if (main.seen) {
        return main.text.toString().strip();
      }
      if (article.seen) {
        return article.text.toString().strip();
      }
      return body.toString().strip();
    }

    private void append(String chars) {
      body.append(chars);
      main.append(chars);
      article.append(chars);
    }

    private static boolean hasSkippedClass(Attributes atts) {
      String classes = atts.getValue("class");
      if (classes == null) {
        return false;
      }
      for (String token : classes.trim().split("\\s+")) {
        if (SKIPPED_CLASSES.contains(token.toLowerCase(Locale.ROOT))) {
          return true;
        }
      }
      return false;
    }

    private static String elementName(String localName, String qName) {
      String name = localName == null || localName.isEmpty() ? qName : localName;
      return name.toLowerCase(Locale.ROOT);
    }
  }

  /** Text of the first element with a given name, nested elements included. */
  private static final class Region {

    private final String element;
    private final StringBuilder text = new StringBuilder();
    private boolean seen;
    private int depth;

    Region(String element) {
      this.element = element;
    }

    void start(String name) {
      if (depth > 0) {
        depth++;
      } else if (!seen && element.equals(name)) {
        seen = true;
        depth = 1;
      }
    }

    void end() {
      if (depth > 0) {
        depth--;
      }
    }

    void append(String chars) {
      if (depth > 0) {
        text.append(chars);
      }
    }
  }
}
