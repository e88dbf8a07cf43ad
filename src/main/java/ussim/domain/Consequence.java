package ussim.domain;

/**
 * Follow-up of an event. {@code target} is an event key for CHAIN_EVENT, a policy template key
 * for POLICY_PROPOSAL and a party id (or {@code opposition}) for PARTY_APPROVAL.
 */
public record Consequence(ConsequenceType type, String target, int delayMonths, double probability, double amount) {
  public Consequence {
    if (type == null) throw new IllegalArgumentException("Consequence type is required");
    if (target == null || target.isBlank()) throw new IllegalArgumentException("Consequence target is required");
    if (delayMonths < 0) throw new IllegalArgumentException("Consequence delay must be >= 0");
    if (probability < 0 || probability > 1) throw new IllegalArgumentException("Consequence probability must be in [0, 1]");
  }
}
