package ussim.phases;

import org.junit.jupiter.api.Test;
import ussim.TestScenarios;
import ussim.core.SimulationState;
import ussim.domain.Nation;
import ussim.domain.State;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EconomyPhaseTest {
  private final EconomyPhase phase = new EconomyPhase();

  @Test
  void federalRevenueFollowsStateOutput() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));

    phase.run(state, TestScenarios.context(state, 1));

    double gdp = state.states().values().stream().mapToDouble(State::gdp).sum();
    assertEquals(state.nation().federalTaxRate() * gdp, state.nation().federalRevenue(), 1e-9);
    for (State st : state.states().values()) {
      assertEquals(st.taxRate() * st.gdp(), st.revenue(), 1e-12);
    }
  }

  @Test
  void partiesRaiseFundsEachMonth() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));

    phase.run(state, TestScenarios.context(state, 1));

    assertEquals(100.0 + EconomyPhase.MONTHLY_DONATIONS, state.party("REP").treasury(), 1e-12);
  }

  @Test
  void indicatorsStayInRangeOverLongRuns() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(9));

    for (int turn = 1; turn <= 240; turn++) {
      phase.run(state, TestScenarios.context(state, turn));
    }

    Nation nation = state.nation();
    assertTrue(nation.growth() >= Nation.MIN_GROWTH && nation.growth() <= Nation.MAX_GROWTH);
    assertTrue(nation.unemployment() >= Nation.MIN_UNEMPLOYMENT && nation.unemployment() <= Nation.MAX_UNEMPLOYMENT);
    for (State st : state.states().values()) {
      assertTrue(st.gdp() > 0);
      assertTrue(st.inflation() >= 0 && st.inflation() <= Nation.MAX_INFLATION);
    }
  }

  @Test
  void sameSeedSameEconomy() {
    SimulationState a = TestScenarios.smallWorld(TestScenarios.config(3));
    SimulationState b = TestScenarios.smallWorld(TestScenarios.config(3));

    phase.run(a, TestScenarios.context(a, 1));
    phase.run(b, TestScenarios.context(b, 1));

    assertEquals(a.state("AA").gdp(), b.state("AA").gdp());
    assertEquals(a.nation().inflation(), b.nation().inflation());
  }

  @Test
  void officeApprovalsRevertTowardBaselines() {
    SimulationState state = TestScenarios.smallWorld(TestScenarios.config(1));
    state.nation().setCongressApproval(20.0);
    State aa = state.state("AA");
    aa.setGovernorApproval(90.0);

    phase.run(state, TestScenarios.context(state, 1));

    assertEquals(21.0, state.nation().congressApproval(), 1e-12);
    assertEquals(88.0, aa.governorApproval(), 1e-12);
    assertEquals(State.LEGISLATURE_APPROVAL_BASELINE, aa.legislatureApproval(), 1e-12);
  }
}
