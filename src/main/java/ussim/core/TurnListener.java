package ussim.core;

/**
 * Observer of turn progress, notified synchronously from inside {@code advance}.
 */
public interface TurnListener {
  default void phaseCompleted(String phaseName, TurnContext turn) {}

  default void turnCompleted(TurnContext turn) {}
}
