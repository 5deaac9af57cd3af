package iocextract.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionWindowTest {

  private static final Instant NOW = Instant.parse("2026-10-19T02:00:00Z");

  @Test
  void endingAtSpansLookback() {
    ExtractionWindow window = ExtractionWindow.endingAt(NOW, Duration.ofHours(24));

    assertEquals(Instant.parse("2026-10-18T02:00:00Z"), window.from());
    assertEquals(NOW, window.to());
    assertEquals(Duration.ofHours(24), window.length());
  }

  @Test
  void boundsAreInclusive() {
    ExtractionWindow window = ExtractionWindow.endingAt(NOW, Duration.ofHours(24));

    assertTrue(window.contains(window.from()));
    assertTrue(window.contains(NOW));
    assertFalse(window.contains(window.from().minusSeconds(1)));
    assertFalse(window.contains(NOW.plusSeconds(1)));
  }

  @Test
  void epochSecondsStayInsideWindow() {
    Instant now = NOW.plusMillis(500);
    ExtractionWindow window = ExtractionWindow.endingAt(now, Duration.ofSeconds(10));

    assertEquals(NOW.minusSeconds(10).getEpochSecond() + 1, window.fromEpochSecond());
    assertEquals(NOW.getEpochSecond(), window.toEpochSecond());
  }

  @Test
  void wholeSecondBoundsAreExact() {
    ExtractionWindow window = ExtractionWindow.endingAt(NOW, Duration.ofHours(1));

    assertEquals(NOW.minusSeconds(3600).getEpochSecond(), window.fromEpochSecond());
  }

  @Test
  void rejectsNegativeLookback() {
    assertThrows(IllegalArgumentException.class,
        () -> ExtractionWindow.endingAt(NOW, Duration.ofSeconds(-1)));
  }

  @Test
  void rejectsInvertedBounds() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExtractionWindow(NOW, NOW.minusSeconds(1)));
  }
}
