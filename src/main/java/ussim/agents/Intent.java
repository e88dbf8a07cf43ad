package ussim.agents;

/**
 * An actor's chosen action for one turn, computed before any of the turn's effects apply.
 *
 * @param templateKey policy template for PROPOSE
 * @param stateId target state for CAMPAIGN, the actor's own state for state actors
 * @param amount campaign spend (billions) for CAMPAIGN
 */
public record Intent(IntentType type, String actorId, String partyId, String templateKey, String stateId,
                     double amount, double score) {
  public static Intent idle(String actorId, String partyId) {
    return new Intent(IntentType.IDLE, actorId, partyId, null, null, 0, 0);
  }

  public static Intent propose(String actorId, String partyId, String templateKey, String stateId, double score) {
    return new Intent(IntentType.PROPOSE, actorId, partyId, templateKey, stateId, 0, score);
  }

  public static Intent campaign(String actorId, String partyId, String stateId, double amount, double score) {
    return new Intent(IntentType.CAMPAIGN, actorId, partyId, null, stateId, amount, score);
  }

  public static Intent adjustBudget(String actorId, String partyId, String stateId, double score) {
    return new Intent(IntentType.ADJUST_BUDGET, actorId, partyId, null, stateId, 0, score);
  }

  public String describe() {
    return switch (type) {
      case PROPOSE -> actorId + " proposes " + templateKey + (stateId == null ? "" : " in " + stateId);
      case CAMPAIGN -> actorId + " campaigns in " + stateId + String.format(" (%.2fB)", amount);
      case ADJUST_BUDGET -> actorId + " tightens the budget of " + stateId;
      case IDLE -> actorId + " holds";
    };
  }
}
