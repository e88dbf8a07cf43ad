package ussim.agents;

import ussim.core.SimulationState;
import ussim.domain.State;

public final class Actors {
  public static final String PARTY_PREFIX = "party:";
  public static final String STATE_PREFIX = "state:";

  private Actors() {}

  public static String partyActorId(String partyId) {
    return PARTY_PREFIX + partyId;
  }

  public static String stateActorId(String stateId) {
    return STATE_PREFIX + stateId;
  }

  public static boolean isPartyActor(String actorId) {
    return actorId != null && actorId.startsWith(PARTY_PREFIX);
  }

  public static boolean isStateActor(String actorId) {
    return actorId != null && actorId.startsWith(STATE_PREFIX);
  }

  /** State id of a state actor, null otherwise. */
  public static String stateOf(String actorId) {
    return isStateActor(actorId) ? actorId.substring(STATE_PREFIX.length()) : null;
  }

  /**
   * Party that sponsors the actor's proposals: the party itself, or a state's governor party.
   *
   * @throws IllegalArgumentException for unknown actors
   */
  public static String sponsorParty(SimulationState state, String actorId) {
    if (isPartyActor(actorId)) {
      String partyId = actorId.substring(PARTY_PREFIX.length());
      return state.party(partyId).id();
    }
    if (isStateActor(actorId)) {
      State st = state.state(stateOf(actorId));
      return st.governorParty();
    }
    throw new IllegalArgumentException("Unknown actor: " + actorId);
  }
}
