package ussim.legislation;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import ussim.TestScenarios;
import ussim.core.SimulationLogger;
import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.domain.Chamber;
import ussim.domain.EffectVector;
import ussim.domain.Issues;
import ussim.domain.Policy;
import ussim.domain.PolicyLevel;
import ussim.domain.PolicyStatus;
import ussim.domain.PolicyTemplate;
import ussim.domain.State;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyPipelineTest {
  private final PolicyPipeline pipeline = new PolicyPipeline(0.5, 2.0 / 3.0, 0.35);

  @BeforeAll
  static void quiet() {
    SimulationLogger.setQuiet(true);
  }

  @Test
  void proposalIsNotPromotedInItsOwnTurn() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    Policy policy = PolicyPipeline.propose(state, TestScenarios.federal("f", Issues.ECONOMY, 1, EffectVector.EMPTY),
        "party:DEM", "DEM", null, 3);

    pipeline.process(state, TestScenarios.context(state, 3));
    assertEquals(PolicyStatus.PROPOSED, policy.status());

    pipeline.process(state, TestScenarios.context(state, 4));
    assertEquals(PolicyStatus.VOTING, policy.status());
    assertEquals(4, policy.votingTurn());

    pipeline.process(state, TestScenarios.context(state, 4));
    assertEquals(PolicyStatus.VOTING, policy.status());
  }

  @Test
  void supermajorityOverridesVeto() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    setSeats(state, 300, 70);
    Policy policy = PolicyPipeline.propose(state, TestScenarios.federal("border", Issues.SECURITY, 1, EffectVector.EMPTY),
        "party:REP", "REP", null, 1);

    pipeline.process(state, TestScenarios.context(state, 2));
    pipeline.process(state, TestScenarios.context(state, 3));

    assertEquals(PolicyStatus.ENACTED, policy.status());
    assertTrue(policy.vetoed());
    assertEquals(3, policy.resolvedTurn());
    assertEquals(2, policy.tallies().size());
  }

  @Test
  void vetoStandsWithoutSupermajority() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    setSeats(state, 240, 55);
    Policy policy = PolicyPipeline.propose(state, TestScenarios.federal("border", Issues.SECURITY, 1, EffectVector.EMPTY),
        "party:REP", "REP", null, 1);

    pipeline.process(state, TestScenarios.context(state, 2));
    TurnContext voting = TestScenarios.context(state, 3);
    pipeline.process(state, voting);

    assertEquals(PolicyStatus.REJECTED, policy.status());
    assertTrue(policy.vetoed());
    assertTrue(policy.tallies().stream().allMatch(t -> t.yesShare() > 0.5));
    assertEquals(List.of(policy.id()), voting.rejectedPolicies());
  }

  @Test
  void presidentsPartyIsNotVetoed() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    setSeats(state, 135, 30);
    Policy policy = PolicyPipeline.propose(state,
        TestScenarios.federal("parks", Issues.ENVIRONMENT, 1, EffectVector.opinionOnly(Issues.ENVIRONMENT, 0.2)),
        "party:DEM", "DEM", null, 1);

    pipeline.process(state, TestScenarios.context(state, 2));
    TurnContext voting = TestScenarios.context(state, 3);
    pipeline.process(state, voting);

    assertEquals(PolicyStatus.ENACTED, policy.status());
    assertFalse(policy.vetoed());
    assertEquals(state.allRegions().size(), voting.drainOpinionQueue().size());
  }

  @Test
  void tiedLegislatureRejects() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    state.state("CC").setLegislature(Map.of("DEM", 50, "REP", 50));
    Policy policy = PolicyPipeline.propose(state,
        TestScenarios.statePolicy("guns", Issues.SECURITY, -1, EffectVector.EMPTY), "state:CC", "DEM", "CC", 1);

    pipeline.process(state, TestScenarios.context(state, 2));
    pipeline.process(state, TestScenarios.context(state, 3));

    assertEquals(PolicyStatus.REJECTED, policy.status());
    assertEquals(0.5, policy.tallies().get(0).yesShare(), 1e-12);
    assertFalse(policy.vetoed());
  }

  @Test
  void statePolicyAffectsOnlyItsState() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    State aa = state.state("AA");
    double spendingBefore = aa.spending();
    double federalBefore = state.nation().federalSpending();
    PolicyTemplate template = new PolicyTemplate("solar", "Solar credits", PolicyLevel.STATE,
        Issues.ENVIRONMENT, 1, 0.1, EffectVector.opinionOnly(Issues.ENVIRONMENT, 0.1));
    Policy policy = PolicyPipeline.propose(state, template, "state:AA", "DEM", "AA", 1);

    pipeline.process(state, TestScenarios.context(state, 2));
    TurnContext voting = TestScenarios.context(state, 3);
    pipeline.process(state, voting);

    assertEquals(PolicyStatus.ENACTED, policy.status());
    assertEquals(spendingBefore + 0.1, aa.spending(), 1e-9);
    assertEquals(federalBefore, state.nation().federalSpending());
    assertEquals(List.of(policy.id()), aa.enactedPolicyIds());
    List<TurnContext.QueuedOpinion> queued = voting.drainOpinionQueue();
    assertEquals(1, queued.size());
    assertEquals("AA", queued.get(0).region());
  }

  @Test
  void proposalChecksRejectBadRequests() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    PolicyTemplate federal = TestScenarios.federal("f", Issues.ECONOMY, 1, EffectVector.EMPTY);
    PolicyTemplate expensive = new PolicyTemplate("stadium", "Stadium", PolicyLevel.STATE,
        Issues.ECONOMY, 1, 1000, EffectVector.EMPTY);

    assertNotNull(PolicyPipeline.checkProposal(state, federal, "AA"));
    assertNotNull(PolicyPipeline.checkProposal(state, expensive, "AA"));
    assertNotNull(PolicyPipeline.checkProposal(state, TestScenarios.statePolicy("s", Issues.ECONOMY, 1, null), "ZZ"));
    assertNull(PolicyPipeline.checkProposal(state, federal, null));
    assertThrows(IllegalStateException.class,
        () -> PolicyPipeline.propose(state, expensive, "state:AA", "DEM", "AA", 1));
    assertTrue(state.policies().isEmpty());
  }

  @Test
  void courtLeaningAgainstSponsorCostsInflationaryPolicyVotes() {
    EffectVector inflationary = new EffectVector(0, 0, 1.0, 0, Map.of());
    SimulationState neutral = TestScenarios.smallWorld(TestScenarios.config(1));
    SimulationState hostile = TestScenarios.smallWorld(TestScenarios.config(1));
    hostile.nation().setCourtLean("REP");
    setSeats(neutral, 200, 50);
    setSeats(hostile, 200, 50);
    Policy a = PolicyPipeline.propose(neutral, TestScenarios.federal("stimulus", Issues.ECONOMY, 1, inflationary),
        "party:DEM", "DEM", null, 1);
    Policy b = PolicyPipeline.propose(hostile, TestScenarios.federal("stimulus", Issues.ECONOMY, 1, inflationary),
        "party:DEM", "DEM", null, 1);

    for (int turn = 2; turn <= 3; turn++) {
      pipeline.process(neutral, TestScenarios.context(neutral, turn));
      pipeline.process(hostile, TestScenarios.context(hostile, turn));
    }

    for (int i = 0; i < 2; i++) {
      assertEquals(a.tallies().get(i).yesShare() - PolicyPipeline.COURT_RISK, b.tallies().get(i).yesShare(), 1e-9);
    }
  }

  @Test
  void courtRiskNeedsHostileCourtAndInflationaryFederalPolicy() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    state.nation().setCourtLean("REP");
    Policy inflationary = PolicyPipeline.propose(state,
        TestScenarios.federal("stimulus", Issues.ECONOMY, 1, new EffectVector(0, 0, 1.0, 0, Map.of())),
        "party:DEM", "DEM", null, 1);
    Policy mild = PolicyPipeline.propose(state,
        TestScenarios.federal("tweak", Issues.ECONOMY, 1, new EffectVector(0, 0, 0.5, 0, Map.of())),
        "party:DEM", "DEM", null, 1);
    Policy friendly = PolicyPipeline.propose(state,
        TestScenarios.federal("tariffs", Issues.ECONOMY, 1, new EffectVector(0, 0, 1.0, 0, Map.of())),
        "party:REP", "REP", null, 1);

    assertEquals(PolicyPipeline.COURT_RISK, PolicyPipeline.courtRisk(state.nation(), inflationary));
    assertEquals(0.0, PolicyPipeline.courtRisk(state.nation(), mild));
    assertEquals(0.0, PolicyPipeline.courtRisk(state.nation(), friendly));
    state.nation().setCourtLean(null);
    assertEquals(0.0, PolicyPipeline.courtRisk(state.nation(), inflationary));
  }

  @Test
  void enactmentLiftsOfficeApprovals() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    setSeats(state, 135, 30);
    State aa = state.state("AA");
    Policy federal = PolicyPipeline.propose(state,
        TestScenarios.federal("parks", Issues.ENVIRONMENT, 1, EffectVector.EMPTY), "party:DEM", "DEM", null, 1);
    Policy local = PolicyPipeline.propose(state,
        TestScenarios.statePolicy("trails", Issues.ENVIRONMENT, 1, EffectVector.EMPTY), "state:AA", "DEM", "AA", 1);

    pipeline.process(state, TestScenarios.context(state, 2));
    pipeline.process(state, TestScenarios.context(state, 3));

    assertEquals(PolicyStatus.ENACTED, federal.status());
    assertEquals(PolicyStatus.ENACTED, local.status());
    assertEquals(51.0, state.nation().presidentApproval(), 1e-12);
    assertEquals(50.8, aa.governorApproval(), 1e-12);
    assertEquals(40.4, aa.legislatureApproval(), 1e-12);
  }

  private static void setSeats(SimulationState state, int repHouse, int repSenate) {
    state.party("REP").setSeats(Chamber.HOUSE, repHouse);
    state.party("DEM").setSeats(Chamber.HOUSE, 435 - repHouse);
    state.party("REP").setSeats(Chamber.SENATE, repSenate);
    state.party("DEM").setSeats(Chamber.SENATE, 100 - repSenate);
  }
}
