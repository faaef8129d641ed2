package ca.gc.cra.ferry.validation;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> String checks for settings that end up in request lines, headers and log lines.
 * <p><strong>Why:</strong> A control character in an HTTP method or header value makes the JDK client reject the
 * request on every worker; catching it at configuration time gives one clear message instead.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final int MAX_HEADER_LENGTH = 8_192;

  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects blank results or embedded control characters.
   *
   * @param name parameter name used in messages; {@code "value"} when {@code null}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    if (trimmed.chars().anyMatch(c -> Character.isISOControl((char) c))) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    return trimmed;
  }

  /**
   * Matches {@code value} case-insensitively against an allowed set of upper-case tokens.
   *
   * @param name parameter name used in messages
   * @param value candidate such as {@code "post"}
   * @param allowed upper-case tokens such as {@code POST}, {@code PUT}
   * @return the canonical upper-case token
   * @throws IllegalArgumentException if the value is blank or not allowed
   */
  public static String requireOneOf(String name, String value, Collection<String> allowed) {
    String token = requireNonBlank(name, value).toUpperCase(Locale.ROOT);
    if (!allowed.contains(token)) {
      throw new IllegalArgumentException(label(name) + " must be one of " + allowed + " (was " + value + ")");
    }
    return token;
  }

  /**
   * Validates a value destined for an HTTP header: visible ASCII and spaces only.
   *
   * @param name parameter name used in messages
   * @param value header value
   * @param maxLength length budget; capped at 8192
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long or contains non-printable characters
   */
  public static String requireHeaderValue(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    int limit = Math.min(maxLength, MAX_HEADER_LENGTH);
    if (trimmed.length() > limit) {
      throw new IllegalArgumentException(label(name) + " must be at most " + limit + " characters");
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(
            label(name) + " may only contain printable ASCII (found U+" + String.format("%04X", (int) c) + ")");
      }
    }
    return trimmed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
