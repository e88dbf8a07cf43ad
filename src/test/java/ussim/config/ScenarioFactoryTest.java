package ussim.config;

import org.junit.jupiter.api.Test;
import ussim.TestScenarios;
import ussim.core.ConfigurationFault;
import ussim.core.SimulationState;
import ussim.domain.Chamber;
import ussim.domain.District;
import ussim.domain.State;
import ussim.domain.VoterCohort;
import ussim.elections.VoterModel;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScenarioFactoryTest {
  private final ScenarioFactory factory = new ScenarioFactory();

  @Test
  void defaultScenarioHasFullSizedCongress() {
    SimulationState state = factory.defaultScenario(SimulationConfig.defaults());

    assertEquals(50, state.states().size());
    assertEquals(435, state.chamberSize(Chamber.HOUSE));
    assertEquals(100, state.chamberSize(Chamber.SENATE));
    int house = 0;
    int senate = 0;
    for (String partyId : state.parties().keySet()) {
      house += state.party(partyId).seats(Chamber.HOUSE);
      senate += state.party(partyId).seats(Chamber.SENATE);
    }
    assertEquals(435, house);
    assertEquals(100, senate);
    assertEquals(52, state.state("CA").districts().size());
  }

  @Test
  void leansAreNormalizedAndSeatsFilled() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));

    for (State st : state.states().values()) {
      assertEquals(1.0, st.lean().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
      assertEquals(st.legislatureSize(), st.legislature().values().stream().mapToInt(Integer::intValue).sum());
      for (District district : st.districts()) {
        assertEquals(1.0, district.lean().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
      }
    }
    assertEquals("DEM", state.state("AA").governorParty());
    assertEquals("REP", state.state("BB").governorParty());
    assertEquals(60, state.state("AA").legislature().get("DEM"));
  }

  @Test
  void sameSeedBuildsSameDistricts() {
    SimulationState a = TestScenarios.smallWorld(TestScenarios.config(4));
    SimulationState b = TestScenarios.smallWorld(TestScenarios.config(4));

    assertEquals(a.state("AA").districts().get(1).lean(), b.state("AA").districts().get(1).lean());
  }

  @Test
  void derivedCohortsReproduceTheLean() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(2));

    for (State st : state.states().values()) {
      assertEquals(2, st.cohorts().size());
      assertEquals(st.lean().get("DEM"), VoterModel.cohortLean(st.cohorts(), Map.of()).get("DEM"), 1e-12);
      for (District district : st.districts()) {
        assertEquals(district.lean().get("REP"), VoterModel.cohortLean(district.cohorts(), Map.of()).get("REP"), 1e-12);
      }
    }
  }

  @Test
  void configuredCohortsDefineTheLean() {
    ScenarioFactory.ScenarioConfig sc = TestScenarios.smallScenario();
    sc.states.get(1).lean = null;
    sc.states.get(1).cohorts = List.of(cohort("Urban", 2, "DEM", 0.5), cohort("Rural", 2, "REP", 0.7),
        cohort("Unaligned", 1, null, 0.4));

    SimulationState state = factory.build(sc, TestScenarios.config(1));

    State bb = state.state("BB");
    assertEquals(0.4 * 0.5 / (0.4 * 0.5 + 0.4 * 0.7), bb.lean().get("DEM"), 1e-12);
    assertEquals(0.4, bb.cohorts().get(0).share(), 1e-12);
    assertNull(bb.cohorts().get(2).lean());
    for (District district : bb.districts()) {
      assertEquals(3, district.cohorts().size());
      assertEquals(1.0, district.cohorts().stream().mapToDouble(VoterCohort::share).sum(), 1e-9);
      assertEquals(1.0, district.lean().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    }
  }

  @Test
  void cohortLeaningToUnknownPartyIsRejected() {
    ScenarioFactory.ScenarioConfig sc = TestScenarios.smallScenario();
    sc.states.get(0).cohorts = List.of(cohort("Urban", 1, "DEM", 0.6), cohort("Greens", 1, "GRN", 0.6));

    assertThrows(ConfigurationFault.class, () -> factory.build(sc, TestScenarios.config(1)));
  }

  @Test
  void defaultScenarioCarriesCourtApprovalsAndCohorts() {
    SimulationState state = factory.defaultScenario(SimulationConfig.defaults());

    assertEquals("REP", state.nation().courtLean());
    assertEquals(51.0, state.nation().presidentApproval());
    assertEquals(38.0, state.nation().congressApproval());
    State pa = state.state("PA");
    assertEquals(3, pa.cohorts().size());
    assertEquals(0.2604 / (0.2604 + 0.244), pa.lean().get("DEM"), 1e-9);
  }

  @Test
  void unknownPresidentIsRejected() {
    ScenarioFactory.ScenarioConfig sc = TestScenarios.smallScenario();
    sc.president = "GRN";

    assertThrows(ConfigurationFault.class, () -> factory.build(sc, TestScenarios.config(1)));
  }

  @Test
  void leanOverUnknownPartyIsRejected() {
    ScenarioFactory.ScenarioConfig sc = TestScenarios.smallScenario();
    sc.states.get(0).lean = Map.of("DEM", 0.5, "GRN", 0.5);

    assertThrows(ConfigurationFault.class, () -> factory.build(sc, TestScenarios.config(1)));
  }

  @Test
  void opinionOutOfRangeIsRejected() {
    ScenarioFactory.ScenarioConfig sc = TestScenarios.smallScenario();
    sc.opinion = Map.of("US", Map.of("economy", 2.0));

    assertThrows(ConfigurationFault.class, () -> factory.build(sc, TestScenarios.config(1)));
  }

  private static ScenarioFactory.CohortConfig cohort(String name, double share, String lean, double turnout) {
    ScenarioFactory.CohortConfig cc = new ScenarioFactory.CohortConfig();
    cc.name = name;
    cc.share = share;
    cc.lean = lean;
    cc.turnout = turnout;
    return cc;
  }
}
