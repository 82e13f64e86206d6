package intake.enrich.builtin;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MetadataEngagementCalculatorTest {
  private final MetadataEngagementCalculator calculator = new MetadataEngagementCalculator();

  @Test
  void ratesAreRelativeToViews() {
    Map<String, Double> stats = calculator.invoke("", Map.of(
        "views", "2000", "forwards", "100", "replies", "20", "reactions", "80"));

    assertEquals(2000.0, stats.get("views"));
    assertEquals(0.05, stats.get("forward_rate"), 1e-9);
    assertEquals(0.04, stats.get("reaction_rate"), 1e-9);
    assertEquals(0.1, stats.get("engagement_rate"), 1e-9);
  }

  @Test
  void missingCountersAreZero() {
    Map<String, Double> stats = calculator.invoke("", Map.of());

    assertEquals(0.0, stats.get("views"));
    assertEquals(0.0, stats.get("engagement_rate"));
  }

  @Test
  void malformedCounterFails() {
    assertThrows(IllegalArgumentException.class, () -> calculator.invoke("", Map.of("views", "lots")));
    assertThrows(IllegalArgumentException.class, () -> calculator.invoke("", Map.of("forwards", "-1")));
  }
}
