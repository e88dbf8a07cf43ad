package ussim.phases;

import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.core.TurnPhase;

/**
 * Applies the opinion effects queued this turn exactly once, then runs one decay pass.
 */
public class OpinionPhase implements TurnPhase {
  @Override
  public String name() { return "Opinion"; }

  @Override
  public void run(SimulationState state, TurnContext turn) {
    for (TurnContext.QueuedOpinion queued : turn.drainOpinionQueue()) {
      state.opinion().apply(queued.effect(), queued.region());
    }
    state.opinion().decayStep();
  }
}
