package ussim.events;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import ussim.TestScenarios;
import ussim.config.EventCatalog;
import ussim.config.PolicyCatalog;
import ussim.core.SimulationLogger;
import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.domain.Consequence;
import ussim.domain.ConsequenceType;
import ussim.domain.EffectVector;
import ussim.domain.EventCondition;
import ussim.domain.EventDefinition;
import ussim.domain.Issues;
import ussim.domain.Policy;
import ussim.domain.PolicyStatus;
import ussim.domain.TriggerType;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventManagerTest {
  private static final EffectVector SLUMP = new EffectVector(-0.01, 0.5, 0, 0, Map.of(Issues.ECONOMY, -0.1));

  @BeforeAll
  static void quiet() {
    SimulationLogger.setQuiet(true);
  }

  @Test
  void conditionalOneShotFiresOnceAndIsRetired() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    EventManager manager = manager(List.of(conditional("layoffs", false, 0, List.of())));
    double growthBefore = state.nation().growth();

    TurnContext first = TestScenarios.context(state, 1);
    assertEquals(List.of("layoffs"), manager.process(state, first));
    assertEquals(growthBefore - 0.01, state.nation().growth(), 1e-12);
    assertEquals(state.allRegions().size(), first.drainOpinionQueue().size());
    assertTrue(state.events().retired().contains("layoffs"));

    assertTrue(manager.process(state, TestScenarios.context(state, 2)).isEmpty());
  }

  @Test
  void recurringEventWaitsOutItsCooldown() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    EventManager manager = manager(List.of(conditional("layoffs", true, 2, List.of())));

    assertEquals(1, manager.process(state, TestScenarios.context(state, 1)).size());
    assertEquals(0, manager.process(state, TestScenarios.context(state, 2)).size());
    assertEquals(1, manager.process(state, TestScenarios.context(state, 3)).size());
  }

  @Test
  void conditionOnUnknownMetricNeverFires() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    EventDefinition odd = new EventDefinition("odd", "Odd", null, 1, TriggerType.CONDITIONAL,
        new EventCondition("sunspots", null, true, 0), 0, 0, SLUMP, List.of(), true, 0, List.of());

    assertTrue(manager(List.of(odd)).process(state, TestScenarios.context(state, 1)).isEmpty());
  }

  @Test
  void chainedEventFiresAfterItsDelay() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    EventDefinition storm = conditional("storm", false, 0,
        List.of(new Consequence(ConsequenceType.CHAIN_EVENT, "relief", 2, 1.0, 0)));
    EventManager manager = manager(List.of(storm, manualOnly("relief")));

    assertEquals(List.of("storm"), manager.process(state, TestScenarios.context(state, 1)));
    assertEquals(1, state.events().scheduled().size());
    assertTrue(manager.process(state, TestScenarios.context(state, 2)).isEmpty());
    assertEquals(List.of("relief"), manager.process(state, TestScenarios.context(state, 3)));
    assertTrue(state.events().scheduled().isEmpty());
  }

  @Test
  void manualTriggersBypassConditions() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    EventManager manager = manager(List.of(manualOnly("summit")));
    state.events().enqueueManual(new EventLedger.ManualTrigger("summit", null, null, null));
    state.events().enqueueManual(new EventLedger.ManualTrigger("manual", "Local flood", SLUMP, List.of("AA")));
    double aaGdp = state.state("AA").gdp();

    TurnContext turn = TestScenarios.context(state, 1);
    assertEquals(List.of("summit", "manual"), manager.process(state, turn));

    List<TurnContext.QueuedOpinion> adHoc = turn.drainOpinionQueue().stream()
        .filter(q -> q.source().equals("manual")).toList();
    assertEquals(1, adHoc.size());
    assertEquals("AA", adHoc.get(0).region());
    assertTrue(state.state("AA").gdp() < aaGdp);
    assertEquals(state.state("BB").gdp(), TestScenarios.smallWorld(TestScenarios.config(1)).state("BB").gdp());
    assertFalse(state.events().retired().contains("manual"));
    assertTrue(state.events().retired().contains("summit"));
    assertTrue(state.events().manualQueue().isEmpty());
  }

  @Test
  void approvalConsequenceHitsTheOpposition() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    EventDefinition scandal = conditional("scandal", false, 0,
        List.of(new Consequence(ConsequenceType.PARTY_APPROVAL, EventManager.OPPOSITION_TARGET, 0, 1.0, -3)));

    manager(List.of(scandal)).process(state, TestScenarios.context(state, 1));

    assertEquals(50.0, state.party("DEM").nationalApproval(), 1e-12);
    assertEquals(47.0, state.party("REP").nationalApproval(), 1e-12);
  }

  @Test
  void policyConsequenceIsSponsoredByThePresident() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    EventDefinition crisis = conditional("crisis", false, 0,
        List.of(new Consequence(ConsequenceType.POLICY_PROPOSAL, "stimulus", 0, 1.0, 0)));
    PolicyCatalog policies = new PolicyCatalog(List.of(
        TestScenarios.federal("stimulus", Issues.ECONOMY, 1, EffectVector.EMPTY)));
    EventManager manager = new EventManager(new EventCatalog(List.of(crisis)), policies, 0.0, 0);

    manager.process(state, TestScenarios.context(state, 4));

    assertEquals(1, state.policies().size());
    Policy policy = state.policies().iterator().next();
    assertEquals("party:DEM", policy.sponsorActorId());
    assertEquals(4, policy.proposedTurn());
    assertEquals(PolicyStatus.PROPOSED, policy.status());
  }

  @Test
  void randomEventsRespectThePerTurnCap() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    List<EventDefinition> randoms = List.of(random("a"), random("b"), random("c"));

    EventManager capped = new EventManager(new EventCatalog(randoms), PolicyCatalog.empty(), 1.0, 1);
    for (int turn = 1; turn <= 10; turn++) {
      assertEquals(1, capped.process(state, TestScenarios.context(state, turn)).size());
    }

    EventManager wide = new EventManager(new EventCatalog(randoms), PolicyCatalog.empty(), 1.0, 5);
    List<String> fired = wide.process(state, TestScenarios.context(state, 11));
    assertEquals(3, fired.size());
    assertEquals(3, fired.stream().distinct().count());
  }

  @Test
  void noRandomEventsWhenChanceIsZero() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    EventManager manager = new EventManager(new EventCatalog(List.of(random("a"))), PolicyCatalog.empty(), 0.0, 3);

    for (int turn = 1; turn <= 10; turn++) {
      assertTrue(manager.process(state, TestScenarios.context(state, turn)).isEmpty());
    }
  }

  private static EventManager manager(List<EventDefinition> events) {
    return new EventManager(new EventCatalog(events), PolicyCatalog.empty(), 0.0, 0);
  }

  private static EventDefinition conditional(String key, boolean recurring, int cooldown, List<Consequence> consequences) {
    return new EventDefinition(key, key, null, 1, TriggerType.CONDITIONAL,
        new EventCondition("unemployment", null, true, 5.0), 0, 0, SLUMP, List.of(), recurring, cooldown, consequences);
  }

  private static EventDefinition manualOnly(String key) {
    return new EventDefinition(key, key, null, 0, TriggerType.MANUAL_ONLY, null, 0, 0,
        EffectVector.opinionOnly(Issues.SECURITY, 0.05), List.of(), false, 0, List.of());
  }

  private static EventDefinition random(String key) {
    return new EventDefinition(key, key, null, 1, TriggerType.RANDOM, null, 0, 0,
        EffectVector.opinionOnly(Issues.HEALTHCARE, 0.01), List.of(), true, 0, List.of());
  }
}
