package ussim.core;

import org.junit.jupiter.api.Test;
import ussim.TestScenarios;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorldSnapshotTest {
  @Test
  void officeApprovalsAreReadableMetrics() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    state.nation().setPresidentApproval(57.0);
    state.nation().setCongressApproval(22.0);
    state.state("BB").setGovernorApproval(64.0);

    WorldSnapshot snapshot = WorldSnapshot.capture(state, 1);
    state.nation().setPresidentApproval(10.0);

    assertEquals(57.0, snapshot.metric("president_approval", null));
    assertEquals(22.0, snapshot.metric("congress_approval", "US"));
    assertEquals(64.0, snapshot.metric("governor_approval", "BB"));
    assertEquals(40.0, snapshot.metric("legislature_approval", "BB"));
    assertTrue(Double.isNaN(snapshot.metric("governor_approval", null)));
    assertTrue(Double.isNaN(snapshot.metric("president_approval", "BB")));
  }
}
