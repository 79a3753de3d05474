package com.flamingo.ai.corpusprep.service.text;

import java.text.Normalizer;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Cleans extracted text before segmentation.
 *
 * <p>Applies, in order: NFC composition, quotation mark and dash canonicalization, removal of
 * control and format characters, whitespace collapsing and trimming. The result is deterministic
 * and never contains two consecutive whitespace characters.
 */
@Component
public class TextNormalizer {

  private static final Pattern DOUBLE_QUOTES =
      Pattern.compile("[\\u201C\\u201D\\u201E\\u201F\\u2033\\u00AB\\u00BB\\u301D\\u301E\\uFF02]");
  private static final Pattern SINGLE_QUOTES =
      Pattern.compile("[\\u2018\\u2019\\u201A\\u201B\\u2032\\u2039\\u203A\\uFF07]");
  private static final Pattern DASHES = Pattern.compile("[\\p{Pd}\\u2212&&[^-]]");
  // Tab, newline etc. are whitespace, not noise.
  private static final Pattern CONTROL_OR_FORMAT =
      Pattern.compile("[\\p{Cc}\\p{Cf}\\p{Co}\\p{Cn}&&[^\\t\\n\\r\\f\\u000B]]");
  private static final Pattern WHITESPACE_RUN =
      Pattern.compile("[\\s\\p{Z}]+", Pattern.UNICODE_CHARACTER_CLASS);

  /**
   * Normalizes the given text.
   *
   * @param text raw extracted text, may be {@code null}
   * @return normalized text; empty when the input is {@code null} or holds only whitespace
   */
  public String normalize(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String result = Normalizer.normalize(text, Normalizer.Form.NFC);
    result = DOUBLE_QUOTES.matcher(result).replaceAll("\"");
    result = SINGLE_QUOTES.matcher(result).replaceAll("'");
    result = DASHES.matcher(result).replaceAll("-");
    result = WHITESPACE_RUN.matcher(result).replaceAll(" ");
    result = CONTROL_OR_FORMAT.matcher(result).replaceAll("");
    // Removing a control character can leave two spaces side by side.
    result = WHITESPACE_RUN.matcher(result).replaceAll(" ");
    return result.trim();
  }
}
