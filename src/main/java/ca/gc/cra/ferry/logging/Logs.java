package ca.gc.cra.ferry.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Bounds the size of API bodies and item renderings before they reach logs or outcome
 * messages, and hides credentials.
 * <p><strong>Why:</strong> A rejected batch can echo back megabytes of payload; every failed item carries a copy of
 * the message, so each copy is capped.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_TEXT = "<null>";
  private static final String REDACTED = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Cuts {@code value} to at most {@code maxBytes} UTF-8 bytes, never splitting a character, and notes the original
   * size.
   *
   * @param value text to bound; {@code null} renders as {@code "<null>"}
   * @param maxBytes byte budget for the kept prefix; must be positive
   * @return {@code value} unchanged when it fits, otherwise the prefix followed by
   *     {@code "... (truncated, kept of total bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_TEXT;
    }
    byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
    if (utf8.length <= maxBytes) {
      return value;
    }
    int end = maxBytes;
    // back off continuation bytes (10xxxxxx) so the cut lands on a character boundary
    while (end > 0 && (utf8[end] & 0xC0) == 0x80) {
      end--;
    }
    String prefix = new String(utf8, 0, end, StandardCharsets.UTF_8);
    return prefix + "... (truncated, " + maxBytes + " of " + utf8.length + " bytes)";
  }

  /**
   * Renders an item for diagnostics within {@code maxBytes}, surviving a throwing {@code toString}.
   *
   * @param value item; may be {@code null}
   * @param maxBytes byte budget
   * @return bounded rendering
   */
  public static String describe(Object value, int maxBytes) {
    String text;
    try {
      text = String.valueOf(value);
    } catch (RuntimeException ex) {
      text = value.getClass().getName() + " (toString failed: " + ex.getClass().getSimpleName() + ")";
    }
    return truncate(text, maxBytes);
  }

  /**
   * Placeholder for a secret such as a bearer token.
   *
   * @param secret ignored
   * @return {@code "[REDACTED]"}
   */
  public static String redact(String secret) {
    return REDACTED;
  }
}
