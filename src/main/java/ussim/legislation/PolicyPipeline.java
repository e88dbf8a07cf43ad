package ussim.legislation;

import ussim.config.SimulationConfig;
import ussim.core.SimulationLogger;
import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.domain.Chamber;
import ussim.domain.Nation;
import ussim.domain.PoliticalParty;
import ussim.domain.Policy;
import ussim.domain.PolicyLevel;
import ussim.domain.PolicyStatus;
import ussim.domain.PolicyTemplate;
import ussim.domain.Regions;
import ussim.domain.State;
import ussim.domain.VoteTally;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Moves policies through PROPOSED, VOTING and a terminal status. A policy proposed in turn T
 * opens for voting in the first later turn and is voted in the turn after that.
 */
public class PolicyPipeline {
  /** A state proposal may not cost more than this share of the state's revenue. */
  public static final double MAX_STATE_COST_SHARE = 0.10;
  static final double OPINION_PULL = 0.25;
  /** Yes-share lost by a federal policy with inflation above the threshold when the court leans against its sponsor. */
  static final double COURT_RISK = 0.05;
  static final double COURT_RISK_INFLATION = 0.7;

  private final double majority;
  private final double supermajority;
  private final double discipline;

  public PolicyPipeline(SimulationConfig config) {
    this(config.voteMajority(), config.voteSupermajority(), config.partyDiscipline());
  }

  public PolicyPipeline(double majority, double supermajority, double discipline) {
    this.majority = majority;
    this.supermajority = supermajority;
    this.discipline = discipline;
  }

  /**
   * Reason a proposal cannot be accepted right now, or null when it can.
   */
  public static String checkProposal(SimulationState state, PolicyTemplate template, String stateId) {
    if (template.level() == PolicyLevel.STATE) {
      if (stateId == null || !state.states().containsKey(stateId)) {
        return "state policy " + template.key() + " needs a known state";
      }
      State st = state.state(stateId);
      if (template.cost() > st.revenue() * MAX_STATE_COST_SHARE) {
        return "policy " + template.key() + " is unaffordable for " + stateId;
      }
    } else if (stateId != null) {
      return "federal policy " + template.key() + " cannot target a state";
    }
    for (Policy pending : state.pendingPolicies()) {
      if (pending.level() == template.level() && pending.key().equals(template.key())
          && Objects.equals(pending.stateId(), stateId)) {
        return "policy " + template.key() + " is already pending as " + pending.id();
      }
    }
    return null;
  }

  /**
   * Registers a new PROPOSED policy.
   *
   * @throws IllegalStateException when {@link #checkProposal} rejects it
   */
  public static Policy propose(SimulationState state, PolicyTemplate template, String sponsorActorId,
                               String sponsorPartyId, String stateId, int proposedTurn) {
    String reason = checkProposal(state, template, stateId);
    if (reason != null) {
      throw new IllegalStateException(reason);
    }
    Policy policy = new Policy(state.nextPolicyId(), template, sponsorActorId, sponsorPartyId, stateId, proposedTurn);
    state.addPolicy(policy);
    state.log(sponsorActorId + " proposed " + policy.id() + " " + template.title());
    SimulationLogger.log("[Policy] " + policy.id() + " proposed by " + sponsorActorId + ": " + template.title());
    return policy;
  }

  /** Promotes waiting proposals, then votes every policy whose voting opened in an earlier turn. */
  public void process(SimulationState state, TurnContext turn) {
    int t = turn.turn();
    for (Policy policy : state.pendingPolicies()) {
      if (policy.status() == PolicyStatus.PROPOSED && policy.proposedTurn() < t) {
        policy.openVoting(t);
      }
    }
    for (Policy policy : state.pendingPolicies()) {
      if (policy.status() == PolicyStatus.VOTING && policy.votingTurn() < t) {
        vote(state, turn, policy);
      }
    }
  }

  private void vote(SimulationState state, TurnContext turn, Policy policy) {
    List<VoteTally> tallies = new ArrayList<>();
    if (policy.level() == PolicyLevel.FEDERAL) {
      for (Chamber chamber : Chamber.values()) {
        tallies.add(tally(state, policy, chamber.name(), chamberSeats(state, chamber), Regions.NATIONAL));
      }
    } else {
      State st = state.state(policy.stateId());
      tallies.add(tally(state, policy, "LEGISLATURE", st.legislature(), st.id()));
    }
    boolean passed = tallies.stream().allMatch(VoteTally::passed);
    boolean vetoed = false;
    if (passed && policy.level() == PolicyLevel.FEDERAL
        && !policy.sponsorPartyId().equals(state.nation().presidentParty())) {
      vetoed = true;
      passed = tallies.stream().allMatch(t -> t.yesShare() > supermajority);
    }
    policy.resolve(passed, tallies, vetoed, turn.turn());
    if (passed) {
      enact(state, turn, policy);
    } else {
      turn.reportRejected(policy.id());
    }
    String outcome = (passed ? "enacted" : "rejected") + (vetoed ? (passed ? " over veto" : " by veto") : "");
    state.log(policy.id() + " " + policy.title() + " " + outcome);
    SimulationLogger.log("[Policy] " + policy.id() + " " + outcome + " " + tallies);
  }

  private static Map<String, Integer> chamberSeats(SimulationState state, Chamber chamber) {
    Map<String, Integer> seats = new TreeMap<>();
    for (PoliticalParty party : state.parties().values()) {
      seats.put(party.id(), party.seats(chamber));
    }
    return seats;
  }

  VoteTally tally(SimulationState state, Policy policy, String chamber, Map<String, Integer> seats, String region) {
    double yes = 0;
    double no = 0;
    double opinion = state.opinion().get(region, policy.issue());
    double courtRisk = courtRisk(state.nation(), policy);
    for (var entry : seats.entrySet()) {
      if (!state.parties().containsKey(entry.getKey())) continue;
      double fraction = Math.max(0.0, yesFraction(state.party(entry.getKey()), policy, opinion) - courtRisk);
      yes += entry.getValue() * fraction;
      no += entry.getValue() * (1.0 - fraction);
    }
    return new VoteTally(chamber, yes, no, majority);
  }

  /** Share of a party's members voting yes. */
  double yesFraction(PoliticalParty party, Policy policy, double regionalOpinion) {
    double fraction = 0.5 + 0.5 * party.stanceOn(policy.issue()) * policy.direction();
    if (party.id().equals(policy.sponsorPartyId())) {
      fraction += discipline;
    }
    fraction += OPINION_PULL * regionalOpinion * policy.direction();
    return Math.max(0.0, Math.min(1.0, fraction));
  }

  /**
   * Members hedge against a strike-down: a federal policy pushing inflation up by more than
   * {@link #COURT_RISK_INFLATION} points loses {@link #COURT_RISK} of its yes share when the
   * Supreme Court leans to a party other than the sponsor's.
   */
  static double courtRisk(Nation nation, Policy policy) {
    if (policy.level() != PolicyLevel.FEDERAL || nation.courtLean() == null) {
      return 0.0;
    }
    if (nation.courtLean().equals(policy.sponsorPartyId())) {
      return 0.0;
    }
    return policy.effect().inflation() > COURT_RISK_INFLATION ? COURT_RISK : 0.0;
  }

  private static void enact(SimulationState state, TurnContext turn, Policy policy) {
    if (policy.level() == PolicyLevel.FEDERAL) {
      state.nation().applyEconomy(policy.effect());
      state.nation().setFederalSpending(state.nation().federalSpending() + policy.cost());
      if (policy.sponsorPartyId().equals(state.nation().presidentParty())) {
        state.nation().setPresidentApproval(state.nation().presidentApproval() + 1.0);
      }
      turn.queueOpinion(state.allRegions(), policy.effect(), policy.id());
    } else {
      State st = state.state(policy.stateId());
      st.applyEconomy(policy.effect());
      st.setSpending(st.spending() + policy.cost());
      st.recordEnactedPolicy(policy.id());
      if (policy.sponsorPartyId().equals(st.governorParty())) {
        st.setGovernorApproval(st.governorApproval() + 0.8);
      }
      st.setLegislatureApproval(st.legislatureApproval() + 0.4);
      turn.queueOpinion(List.of(st.id()), policy.effect(), policy.id());
    }
    turn.reportEnacted(policy.id());
  }
}
