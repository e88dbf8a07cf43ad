package ussim.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SimulationConfigTest {
  @Test
  void missingFileFallsBackToDefaults(@TempDir Path dir) throws Exception {
    SimulationConfig config = SimulationConfig.load(dir.resolve("absent.properties"));

    assertEquals(SimulationConfig.defaults().voteSupermajority(), config.voteSupermajority());
    assertEquals(SimulationConfig.DEFAULT_EVENTS_PATH, config.eventsPath());
  }

  @Test
  void propertiesOverrideDefaults(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("sim.properties");
    Files.writeString(file, String.join("\n",
        "seed=77",
        "start.year=2030",
        "start.month=6",
        "opinion.decay_rate=0.1",
        "events.max_random_per_turn=3",
        "policies.path=/tmp/policies.json"));

    SimulationConfig config = SimulationConfig.load(file);

    assertEquals(77L, config.seed());
    assertEquals(2030, config.startYear());
    assertEquals(6, config.startMonth());
    assertEquals(0.1, config.opinionDecayRate());
    assertEquals(3, config.maxRandomEventsPerTurn());
    assertEquals("/tmp/policies.json", config.policiesPath());
    assertEquals(0.35, config.partyDiscipline());
  }

  @Test
  void malformedNumbersAreRejected(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("sim.properties");
    Files.writeString(file, "vote.majority=half\n");

    assertThrows(IllegalArgumentException.class, () -> SimulationConfig.load(file));
  }

  @Test
  void inconsistentThresholdsAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> SimulationConfig.builder().voteMajority(0.6).voteSupermajority(0.55).build());
    assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().start(2025, 13).build());
    assertThrows(IllegalArgumentException.class, () -> SimulationConfig.builder().opinionDecayRate(1.5).build());
  }
}
