package com.flamingo.ai.corpusprep.service.extract;

import com.flamingo.ai.corpusprep.exception.ExtractionException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/** Strict UTF-8 decoding shared by the text-based extractors. */
final class Utf8 {

  private static final char BOM = '\uFEFF';

  private Utf8() {}

  /**
   * Decodes the bytes, rejecting malformed or unmappable sequences.
   *
   * @throws ExtractionException if the bytes are not valid UTF-8
   */
  static String decode(byte[] bytes, String sourceId) {
    try {
      String text =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString();
      return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    } catch (CharacterCodingException e) {
      throw new ExtractionException(sourceId, "Content is not valid UTF-8: " + e.getMessage(), e);
    }
  }
}
