package ussim.core;

public interface TurnPhase {
  String name();
  void run(SimulationState state, TurnContext turn);
}
