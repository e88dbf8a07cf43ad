package ussim.agents;

import ussim.core.WorldSnapshot;
import ussim.random.RandomStream;

/**
 * Anything that takes a decision each turn. Implementations must be pure functions of the
 * snapshot and the stream: no shared mutable state, no reads of the live simulation.
 */
public interface Actor {
  String id();

  Intent decide(WorldSnapshot snapshot, RandomStream stream);
}
