package ussim.phases;

import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.core.TurnPhase;
import ussim.events.EventManager;

public class EventPhase implements TurnPhase {
  private final EventManager events;

  public EventPhase(EventManager events) {
    this.events = events;
  }

  @Override
  public String name() { return "Events"; }

  @Override
  public void run(SimulationState state, TurnContext turn) {
    events.process(state, turn);
  }
}
