package ussim.opinion;

import org.junit.jupiter.api.Test;
import ussim.domain.Issues;
import ussim.random.RandomStream;
import ussim.random.RandomStreams;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PublicOpinionTrackerTest {
  @Test
  void valuesStayWithinBoundsUnderArbitraryUpdates() {
    PublicOpinionTracker tracker = new PublicOpinionTracker(0.1, 0.5);
    RandomStream rng = new RandomStreams(99).open("test", 1);
    List<String> regions = List.of("US", "AA", "BB");
    for (int i = 0; i < 2000; i++) {
      String region = regions.get(rng.nextInt(regions.size()));
      String issue = Issues.ALL.get(rng.nextInt(Issues.ALL.size()));
      tracker.apply(rng.uniform(-3, 3), region, issue);
      if (i % 7 == 0) tracker.decayStep();
    }
    for (Map<String, Double> byIssue : tracker.entries().values()) {
      for (double v : byIssue.values()) {
        assertTrue(v >= PublicOpinionTracker.MIN && v <= PublicOpinionTracker.MAX, "out of range: " + v);
      }
    }
  }

  @Test
  void singleUpdateIsClampedToMaxDelta() {
    PublicOpinionTracker tracker = new PublicOpinionTracker(0.05, 0.2);

    assertEquals(0.2, tracker.apply(0.9, "US", Issues.ECONOMY), 1e-12);
    assertEquals(-0.2, tracker.apply(-5, "AA", Issues.ECONOMY), 1e-12);
    assertEquals(0.0, tracker.get("BB", Issues.ECONOMY));
  }

  @Test
  void decayPullsTowardBaseline() {
    PublicOpinionTracker tracker = new PublicOpinionTracker(0.25, 0.5);
    tracker.apply(0.4, "US", Issues.HEALTHCARE);
    tracker.apply(-0.4, "US", Issues.SECURITY);

    tracker.decayStep();

    assertEquals(0.3, tracker.get("US", Issues.HEALTHCARE), 1e-12);
    assertEquals(-0.3, tracker.get("US", Issues.SECURITY), 1e-12);
  }

  @Test
  void restoringRejectsOutOfRangeValues() {
    PublicOpinionTracker tracker = new PublicOpinionTracker(0.05, 0.5);
    tracker.set("US", Issues.EDUCATION, 1.0);

    assertThrows(IllegalArgumentException.class, () -> tracker.set("US", Issues.EDUCATION, 1.5));
    assertThrows(IllegalArgumentException.class, () -> tracker.set("US", Issues.EDUCATION, Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> tracker.apply(Double.NaN, "US", Issues.EDUCATION));
  }

  @Test
  void copyIsIndependent() {
    PublicOpinionTracker tracker = new PublicOpinionTracker(0.05, 0.5);
    tracker.apply(0.1, "US", Issues.ECONOMY);
    PublicOpinionTracker copy = tracker.copy();

    copy.apply(0.2, "US", Issues.ECONOMY);

    assertEquals(0.1, tracker.get("US", Issues.ECONOMY), 1e-12);
    assertEquals(tracker.decayRate(), copy.decayRate());
  }
}
