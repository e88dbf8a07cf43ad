package ussim.agents;

import org.junit.jupiter.api.Test;
import ussim.TestScenarios;
import ussim.config.CatalogLoader;
import ussim.config.PolicyCatalog;
import ussim.config.SimulationConfig;
import ussim.core.ConfigurationFault;
import ussim.core.SimulationFault;
import ussim.core.SimulationState;
import ussim.core.WorldSnapshot;
import ussim.domain.PolicyLevel;
import ussim.random.RandomStream;
import ussim.random.RandomStreams;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AIDecisionEngineTest {
  private final PolicyCatalog catalog = new CatalogLoader().loadPolicies(SimulationConfig.DEFAULT_POLICIES_PATH);

  @Test
  void everyActorGetsExactlyOneIntent() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(8));
    AIDecisionEngine engine = new AIDecisionEngine(AIDecisionEngine.defaultActors(state, catalog, 0.01));

    SortedMap<String, Intent> intents = engine.collect(WorldSnapshot.capture(state, 1), state.streams());

    assertEquals(List.of("party:DEM", "party:REP", "state:AA", "state:BB", "state:CC"), new ArrayList<>(intents.keySet()));
    for (var entry : intents.entrySet()) {
      assertEquals(entry.getKey(), entry.getValue().actorId());
      assertNotNull(entry.getValue().describe());
    }
  }

  @Test
  void actorOrderDoesNotChangeDecisions() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(8));
    WorldSnapshot snapshot = WorldSnapshot.capture(state, 1);
    List<Actor> actors = AIDecisionEngine.defaultActors(state, catalog, 0.2);
    List<Actor> reversed = new ArrayList<>(actors);
    Collections.reverse(reversed);

    SortedMap<String, Intent> forward = new AIDecisionEngine(actors).collect(snapshot, new RandomStreams(8));
    SortedMap<String, Intent> backward = new AIDecisionEngine(reversed).collect(snapshot, new RandomStreams(8));

    assertEquals(forward, backward);
  }

  @Test
  void stateActorsOnlyProposeStatePoliciesForTheirOwnState() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(2));
    AIDecisionEngine engine = new AIDecisionEngine(AIDecisionEngine.defaultActors(state, catalog, 0.5));
    for (int turn = 1; turn <= 20; turn++) {
      for (Intent intent : engine.collect(WorldSnapshot.capture(state, turn), state.streams()).values()) {
        if (intent.type() != IntentType.PROPOSE || !Actors.isStateActor(intent.actorId())) continue;
        assertEquals(Actors.stateOf(intent.actorId()), intent.stateId());
        assertEquals(PolicyLevel.STATE, catalog.get(intent.templateKey()).level());
      }
    }
  }

  @Test
  void duplicateActorIdsAreRejected() {
    PartyActor first = new PartyActor("DEM", catalog, 0);
    PartyActor second = new PartyActor("DEM", catalog, 0);

    assertThrows(ConfigurationFault.class, () -> new AIDecisionEngine(List.of(first, second)));
  }

  @Test
  void actorFailureBecomesSimulationFault() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    Actor broken = new Actor() {
      @Override
      public String id() { return "test:broken"; }

      @Override
      public Intent decide(WorldSnapshot snapshot, RandomStream stream) {
        return Intent.idle("someone-else", null);
      }
    };

    SimulationFault fault = assertThrows(SimulationFault.class,
        () -> new AIDecisionEngine(List.of(broken)).collect(WorldSnapshot.capture(state, 4), state.streams()));
    assertEquals("test:broken", fault.actorId());
    assertTrue(fault.getMessage().contains("another actor"));
  }
}
