package intake.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorMessagesTest {

  @Test
  void describesWithSimpleClassName() {
    assertEquals("IllegalStateException: broken", ErrorMessages.describe(new IllegalStateException("broken")));
  }

  @Test
  void walksPastWrappersWithoutMessage() {
    RuntimeException wrapper = new RuntimeException((String) null, new IOException("disk full"));

    assertEquals("IOException: disk full", ErrorMessages.describe(wrapper));
  }

  @Test
  void keepsTheOuterMessageWhenPresent() {
    UncheckedIOException e = new UncheckedIOException("write failed", new IOException("disk full"));

    assertEquals("UncheckedIOException: write failed", ErrorMessages.describe(e));
  }

  @Test
  void noMessageFallsBackToClassName() {
    assertEquals("NullPointerException", ErrorMessages.describe(new NullPointerException()));
    assertNull(ErrorMessages.describe(null));
  }

  @Test
  void longErrorsAreTruncated() {
    String error = ErrorMessages.describe(new IllegalArgumentException("x".repeat(10_000)));

    assertEquals(ErrorMessages.MAX_ERROR_LENGTH, error.length());
    assertTrue(error.startsWith("IllegalArgumentException: xxx"));
    assertEquals("short", ErrorMessages.truncate("short"));
  }
}
