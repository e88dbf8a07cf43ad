package ussim.agents;

import ussim.config.PolicyCatalog;
import ussim.core.ConfigurationFault;
import ussim.core.SimulationFault;
import ussim.core.SimulationState;
import ussim.core.WorldSnapshot;
import ussim.random.RandomStream;
import ussim.random.RandomStreams;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Collects one intent from every actor against the same snapshot before any is applied.
 * Each actor draws from its own stream, keyed by actor id.
 */
public class AIDecisionEngine {
  private final List<Actor> actors;

  public AIDecisionEngine(List<Actor> actors) {
    Set<String> seen = new HashSet<>();
    for (Actor actor : actors) {
      if (!seen.add(actor.id())) {
        throw new ConfigurationFault(actor.id(), "Duplicate actor id");
      }
    }
    this.actors = List.copyOf(actors);
  }

  /** One party actor per party and one state actor per state. */
  public static List<Actor> defaultActors(SimulationState state, PolicyCatalog catalog, double noise) {
    List<Actor> actors = new ArrayList<>();
    for (String partyId : state.parties().keySet()) {
      actors.add(new PartyActor(partyId, catalog, noise));
    }
    for (String stateId : state.states().keySet()) {
      actors.add(new StateActor(stateId, catalog, noise));
    }
    return actors;
  }

  public List<Actor> actors() { return Collections.unmodifiableList(actors); }

  public SortedMap<String, Intent> collect(WorldSnapshot snapshot, RandomStreams streams) {
    SortedMap<String, Intent> intents = new TreeMap<>();
    for (Actor actor : actors) {
      RandomStream stream = streams.open("actor:" + actor.id(), snapshot.turn());
      Intent intent;
      try {
        intent = actor.decide(snapshot, stream);
      } catch (RuntimeException e) {
        throw new SimulationFault(snapshot.turn(), actor.id(), null, "Actor decision failed: " + e.getMessage(), e);
      }
      if (intent == null || !actor.id().equals(intent.actorId())) {
        throw new SimulationFault(snapshot.turn(), actor.id(), null, "Actor returned an intent for another actor");
      }
      intents.put(actor.id(), intent);
    }
    return intents;
  }
}
