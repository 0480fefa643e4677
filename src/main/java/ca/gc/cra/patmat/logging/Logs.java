package ca.gc.cra.patmat.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep dispatch diagnostics bounded.
 * <p><strong>Why:</strong> Dispatch failures and trace logs render actual call arguments, which may be large
 * documents or collections.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by dispatch failures and engine trace logging.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Render arbitrary argument values, including arrays, as readable text.</li>
 *   <li>Truncate UTF-8 renderings to a byte budget while preserving readability.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Truncation allocates transient buffers proportional to {@code maxBytes}.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
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
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, Math.min(bytes.length, maxBytes), StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Renders a value for diagnostics: strings are quoted, arrays are expanded, {@code null} is a placeholder.
   *
   * @param value value to render; may be {@code null}
   * @return human-readable rendering
   */
  public static String describe(Object value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (value instanceof CharSequence text) {
      return "\"" + text + "\"";
    }
    if (value instanceof Object[] array) {
      return Arrays.deepToString(array);
    }
    if (value.getClass().isArray()) {
      return Arrays.deepToString(new Object[] {value}).replaceFirst("^\\[(.*)]$", "$1");
    }
    return String.valueOf(value);
  }
}
