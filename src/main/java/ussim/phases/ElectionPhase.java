package ussim.phases;

import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.core.TurnPhase;
import ussim.elections.ElectionScheduler;

public class ElectionPhase implements TurnPhase {
  private final ElectionScheduler scheduler;

  public ElectionPhase(ElectionScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @Override
  public String name() { return "Elections"; }

  @Override
  public void run(SimulationState state, TurnContext turn) {
    scheduler.runDue(state, turn);
  }
}
