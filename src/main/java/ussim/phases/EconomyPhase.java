package ussim.phases;

import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.core.TurnPhase;
import ussim.domain.Nation;
import ussim.domain.PoliticalParty;
import ussim.domain.State;
import ussim.random.RandomStream;

/**
 * Monthly macro tick: national drift, per-state economies and budgets, federal revenue,
 * party fundraising and office approvals. Draws come from the "economy" stream in state-id order.
 */
public class EconomyPhase implements TurnPhase {
  public static final String STREAM_KEY = "economy";
  static final double MONTHLY_DONATIONS = 0.5;
  static final double APPROVAL_REVERSION = 0.05;

  @Override
  public String name() { return "Economy"; }

  @Override
  public void run(SimulationState state, TurnContext turn) {
    RandomStream stream = state.streams().open(STREAM_KEY, turn.turn());
    Nation nation = state.nation();
    nation.setGrowth(nation.growth() + stream.uniform(-0.002, 0.002));
    nation.setInflation(nation.inflation() + stream.uniform(-0.05, 0.05));
    nation.setUnemployment(nation.unemployment() + stream.uniform(-0.05, 0.05));

    double totalGdp = 0;
    for (State st : state.states().values()) {
      tickState(st, nation, stream);
      totalGdp += st.gdp();
    }
    if (!state.states().isEmpty()) {
      nation.setFederalRevenue(nation.federalTaxRate() * totalGdp);
    }

    // growth in points minus the misery terms; sits near zero in a calm economy
    double signal = (nation.growth() * 100.0 - 2.0) - 0.2 * (nation.inflation() - 2.5)
        - 0.3 * (nation.unemployment() - 5.5);
    for (PoliticalParty party : state.parties().values()) {
      party.setTreasury(party.treasury() + MONTHLY_DONATIONS * party.nationalApproval() / 50.0);
      if (party.id().equals(nation.presidentParty())) {
        party.adjustApproval(0.1 * signal);
      }
    }
    tickApprovals(state, signal);
  }

  /** Office approvals revert toward their baselines; the president's also follows the economy. */
  static void tickApprovals(SimulationState state, double economySignal) {
    Nation nation = state.nation();
    nation.setPresidentApproval(nation.presidentApproval()
        + APPROVAL_REVERSION * (Nation.PRESIDENT_APPROVAL_BASELINE - nation.presidentApproval()) + 0.1 * economySignal);
    nation.setCongressApproval(nation.congressApproval()
        + APPROVAL_REVERSION * (Nation.CONGRESS_APPROVAL_BASELINE - nation.congressApproval()));
    for (State st : state.states().values()) {
      st.setGovernorApproval(st.governorApproval()
          + APPROVAL_REVERSION * (State.GOVERNOR_APPROVAL_BASELINE - st.governorApproval()));
      st.setLegislatureApproval(st.legislatureApproval()
          + APPROVAL_REVERSION * (State.LEGISLATURE_APPROVAL_BASELINE - st.legislatureApproval()));
    }
  }

  private static void tickState(State st, Nation nation, RandomStream stream) {
    double growth = Math.max(-0.1, Math.min(0.1, nation.growth() + stream.uniform(-0.01, 0.01)));
    st.setGdp(st.gdp() * (1.0 + growth / 12.0));
    double targetUnemployment = 5.5 - 0.5 * nation.growth() * 100.0;
    double unemployment = st.unemployment() + 0.2 * (targetUnemployment - st.unemployment())
        + stream.uniform(-0.1, 0.1);
    st.setUnemployment(Math.max(Nation.MIN_UNEMPLOYMENT, Math.min(Nation.MAX_UNEMPLOYMENT, unemployment)));
    double inflation = st.inflation() + 0.3 * (nation.inflation() - st.inflation()) + stream.uniform(-0.1, 0.1);
    st.setInflation(Math.max(0.0, Math.min(Nation.MAX_INFLATION, inflation)));
    st.setRevenue(st.taxRate() * st.gdp());
    st.setSpending(st.spending() + 0.2 * (st.revenue() - st.spending()) + stream.uniform(-0.01, 0.01) * st.revenue());
  }
}
