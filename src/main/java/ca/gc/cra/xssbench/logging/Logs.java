package ca.gc.cra.xssbench.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep attack payloads readable and bounded in logs and reports.
 * <p><strong>Why:</strong> Vector payloads and sanitizer output can be arbitrarily long and carry raw
 * newlines; printing them verbatim floods the console and splits log records.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by the harness, the case runner and the CLI report.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so a cut in the middle of a code point is dropped
 *     instead of raising.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Renders a value as a double-quoted literal with quotes, backslashes and line breaks escaped.
   *
   * @param value text to quote; {@code null} results in {@code "<null>"}
   * @return quoted literal on a single line
   */
  public static String quote(String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder out = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> out.append(c);
      }
    }
    return out.append('"').toString();
  }

  /**
   * Quotes a value and cuts the literal to {@code limit} characters, ending it with {@code ...}.
   *
   * @param value text to quote
   * @param limit maximum length of the returned literal; must be greater than 3
   * @return quoted literal, shortened when needed
   */
  public static String quoteTruncated(String value, int limit) {
    if (limit <= 3) {
      throw new IllegalArgumentException("limit must be greater than 3");
    }
    String quoted = quote(value);
    if (quoted.length() <= limit) {
      return quoted;
    }
    return quoted.substring(0, limit - 3) + "...";
  }
}
