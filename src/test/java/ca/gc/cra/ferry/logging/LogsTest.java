package ca.gc.cra.ferry.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("HTTP 500", Logs.truncate("HTTP 500", 1000));
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void truncateAppendsLengthMetadata() {
    String truncated = Logs.truncate("a".repeat(1500), 1000);

    assertTrue(truncated.startsWith("a".repeat(1000) + "..."));
    assertTrue(truncated.endsWith("(truncated, 1000 of 1500 bytes)"));
  }

  @Test
  void truncateDoesNotSplitMultiByteCharacters() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é..."));
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void describeRendersNullAndBrokenToString() {
    Object broken = new Object() {
      @Override
      public String toString() {
        throw new IllegalStateException("boom");
      }
    };

    assertEquals("null", Logs.describe(null, 50));
    assertTrue(Logs.describe(broken, 200).contains("toString failed: IllegalStateException"));
  }

  @Test
  void redactHidesValue() {
    assertEquals("[REDACTED]", Logs.redact("Bearer abc"));
  }
}
