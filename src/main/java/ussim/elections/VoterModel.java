package ussim.elections;

import ussim.config.SimulationConfig;
import ussim.domain.Issues;
import ussim.domain.PoliticalParty;
import ussim.domain.VoterCohort;
import ussim.opinion.PublicOpinionTracker;
import ussim.random.RandomStream;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Electorate abstraction: turns the cohort baseline, regional opinion, incumbency, campaign
 * spend and approval signals into normalized vote shares for one race.
 */
public class VoterModel {
  static final double MIN_SCORE = 0.001;

  /**
   * One contested seat. {@code incumbent} is null for a vacant seat; {@code signals} holds
   * per-party score shifts from office approvals.
   */
  public record Race(String seatId, String region, Map<String, Double> lean, String incumbent,
                     Map<String, Double> campaignSpend, Map<String, Double> signals) {
    public Race(String seatId, String region, Map<String, Double> lean, String incumbent,
                Map<String, Double> campaignSpend) {
      this(seatId, region, lean, incumbent, campaignSpend, Map.of());
    }
  }

  private final double incumbencyBonus;
  private final double campaignEffect;
  private final double opinionWeight;
  private final double noise;

  public VoterModel(SimulationConfig config) {
    this(config.incumbencyBonus(), config.campaignEffect(), config.electionOpinionWeight(), config.electionNoise());
  }

  public VoterModel(double incumbencyBonus, double campaignEffect, double opinionWeight, double noise) {
    this.incumbencyBonus = incumbencyBonus;
    this.campaignEffect = campaignEffect;
    this.opinionWeight = opinionWeight;
    this.noise = Math.max(0.0, noise);
  }

  /**
   * Vote shares per candidate party, summing to one. Noise is drawn in party-id order.
   */
  public Map<String, Double> voteShares(Race race, Collection<PoliticalParty> candidates,
                                        PublicOpinionTracker opinion, RandomStream stream) {
    List<PoliticalParty> ordered = new ArrayList<>(candidates);
    ordered.sort(Comparator.comparing(PoliticalParty::id));
    Map<String, Double> scores = new TreeMap<>();
    double total = 0;
    for (PoliticalParty party : ordered) {
      double score = race.lean().getOrDefault(party.id(), 0.0);
      score += opinionWeight * alignment(party, race.region(), opinion);
      if (party.id().equals(race.incumbent())) {
        score += incumbencyBonus;
      }
      double spend = race.campaignSpend() == null ? 0.0 : race.campaignSpend().getOrDefault(party.id(), 0.0);
      if (spend > 0) {
        score += campaignEffect * spend / (spend + 1.0);
      }
      score += (party.nationalApproval() - 50.0) / 500.0;
      if (race.signals() != null) {
        score += race.signals().getOrDefault(party.id(), 0.0);
      }
      if (noise > 0) {
        score += stream.uniform(-noise, noise);
      }
      score = Math.max(MIN_SCORE, score);
      scores.put(party.id(), score);
      total += score;
    }
    Map<String, Double> shares = new TreeMap<>();
    for (var entry : scores.entrySet()) {
      shares.put(entry.getKey(), entry.getValue() / total);
    }
    return shares;
  }

  /**
   * Baseline party shares implied by an electorate: each cohort contributes share times turnout
   * to the party it leans to, and unaligned cohorts dilute every party. Returns {@code fallback}
   * when there are no cohorts or nobody turns out.
   */
  public static Map<String, Double> cohortLean(List<VoterCohort> cohorts, Map<String, Double> fallback) {
    Map<String, Double> weights = new TreeMap<>();
    double total = 0;
    for (VoterCohort cohort : cohorts) {
      double weight = cohort.weight();
      if (weight <= 0) continue;
      total += weight;
      if (cohort.lean() != null) {
        weights.merge(cohort.lean(), weight, Double::sum);
      }
    }
    if (total <= 0) {
      return fallback;
    }
    for (var entry : weights.entrySet()) {
      entry.setValue(entry.getValue() / total);
    }
    return weights;
  }

  /** Mean over issues of platform stance times regional opinion. */
  public static double alignment(PoliticalParty party, String region, PublicOpinionTracker opinion) {
    double sum = 0;
    for (String issue : Issues.ALL) {
      sum += party.stanceOn(issue) * opinion.get(region, issue);
    }
    return sum / Issues.ALL.size();
  }

  /**
   * Plurality winner. An exact tie goes to the incumbent party when it is among the tied
   * candidates, otherwise to the lexicographically-first party id.
   */
  public static String pickWinner(Map<String, Double> shares, String incumbent) {
    if (shares.isEmpty()) {
      throw new IllegalArgumentException("No candidates");
    }
    double best = Double.NEGATIVE_INFINITY;
    List<String> tied = new ArrayList<>();
    for (var entry : new TreeMap<>(shares).entrySet()) {
      double share = entry.getValue();
      if (share > best) {
        best = share;
        tied.clear();
        tied.add(entry.getKey());
      } else if (share == best) {
        tied.add(entry.getKey());
      }
    }
    if (incumbent != null && tied.contains(incumbent)) {
      return incumbent;
    }
    return tied.get(0);
  }

  /**
   * Largest-remainder apportionment of {@code seats} by share; remainder ties go to the
   * lexicographically-first party. The result always sums to {@code seats}.
   */
  public static Map<String, Integer> allocateSeats(Map<String, Double> shares, int seats) {
    Map<String, Integer> allocation = new TreeMap<>();
    List<Map.Entry<String, Double>> remainders = new ArrayList<>();
    double total = 0;
    for (double share : shares.values()) total += share;
    int assigned = 0;
    for (var entry : new TreeMap<>(shares).entrySet()) {
      double exact = total <= 0 ? 0 : entry.getValue() / total * seats;
      int whole = (int) Math.floor(exact);
      allocation.put(entry.getKey(), whole);
      assigned += whole;
      remainders.add(Map.entry(entry.getKey(), exact - whole));
    }
    remainders.sort(Comparator.comparing((Map.Entry<String, Double> e) -> e.getValue()).reversed()
        .thenComparing(Map.Entry::getKey));
    for (int i = 0; assigned < seats && !remainders.isEmpty(); i = (i + 1) % remainders.size()) {
      allocation.merge(remainders.get(i).getKey(), 1, Integer::sum);
      assigned++;
    }
    return allocation;
  }
}
