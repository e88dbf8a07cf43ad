package ussim.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Policy state machine: PROPOSED -> VOTING -> {ENACTED, REJECTED}. Terminal states are final.
 */
public class Policy {
  private final String id;
  private final PolicyTemplate template;
  private final String sponsorActorId;
  private final String sponsorPartyId;
  private final String stateId; // null for federal policies
  private final int proposedTurn;

  private PolicyStatus status = PolicyStatus.PROPOSED;
  private int votingTurn = -1;
  private int resolvedTurn = -1;
  private final List<VoteTally> tallies = new ArrayList<>();
  private boolean vetoed;

  public Policy(String id, PolicyTemplate template, String sponsorActorId, String sponsorPartyId,
                String stateId, int proposedTurn) {
    this.id = id;
    this.template = template;
    this.sponsorActorId = sponsorActorId;
    this.sponsorPartyId = sponsorPartyId;
    this.stateId = stateId;
    this.proposedTurn = proposedTurn;
  }

  public String id() { return id; }
  public PolicyTemplate template() { return template; }
  public String key() { return template.key(); }
  public String title() { return template.title(); }
  public PolicyLevel level() { return template.level(); }
  public String issue() { return template.issue(); }
  public double direction() { return template.direction(); }
  public double cost() { return template.cost(); }
  public EffectVector effect() { return template.effect(); }
  public String sponsorActorId() { return sponsorActorId; }
  public String sponsorPartyId() { return sponsorPartyId; }
  public String stateId() { return stateId; }
  public int proposedTurn() { return proposedTurn; }
  public PolicyStatus status() { return status; }
  public int votingTurn() { return votingTurn; }
  public int resolvedTurn() { return resolvedTurn; }
  public List<VoteTally> tallies() { return Collections.unmodifiableList(tallies); }
  public boolean vetoed() { return vetoed; }

  public boolean isPending() {
    return !status.isTerminal();
  }

  public void openVoting(int turn) {
    if (status != PolicyStatus.PROPOSED) {
      throw new IllegalStateException("Policy " + id + " cannot enter voting from " + status);
    }
    status = PolicyStatus.VOTING;
    votingTurn = turn;
  }

  public void resolve(boolean enacted, List<VoteTally> rollCalls, boolean vetoed, int turn) {
    if (status != PolicyStatus.VOTING) {
      throw new IllegalStateException("Policy " + id + " cannot be resolved from " + status);
    }
    status = enacted ? PolicyStatus.ENACTED : PolicyStatus.REJECTED;
    resolvedTurn = turn;
    this.vetoed = vetoed;
    tallies.clear();
    tallies.addAll(rollCalls);
  }

  /** Rebuilds a persisted policy without replaying its transitions. */
  public static Policy restore(String id, PolicyTemplate template, String sponsorActorId, String sponsorPartyId,
                               String stateId, int proposedTurn, PolicyStatus status, int votingTurn,
                               int resolvedTurn, boolean vetoed, List<VoteTally> tallies) {
    Policy policy = new Policy(id, template, sponsorActorId, sponsorPartyId, stateId, proposedTurn);
    policy.status = status;
    policy.votingTurn = votingTurn;
    policy.resolvedTurn = resolvedTurn;
    policy.vetoed = vetoed;
    policy.tallies.addAll(tallies);
    return policy;
  }
}
