package ussim.phases;

import ussim.agents.AIDecisionEngine;
import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.core.TurnPhase;

/**
 * Collects every actor's intent against the pre-turn snapshot. Nothing is applied here.
 */
public class DecisionPhase implements TurnPhase {
  private final AIDecisionEngine engine;

  public DecisionPhase(AIDecisionEngine engine) {
    this.engine = engine;
  }

  @Override
  public String name() { return "Decisions"; }

  @Override
  public void run(SimulationState state, TurnContext turn) {
    turn.setIntents(engine.collect(turn.snapshot(), state.streams()));
  }
}
