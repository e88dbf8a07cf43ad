package ussim.agents;

import ussim.config.PolicyCatalog;
import ussim.core.WorldSnapshot;
import ussim.domain.EffectVector;
import ussim.domain.Issues;
import ussim.random.RandomStream;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Shared scoring for heuristic actors: each candidate action gets a weighted score of opinion
 * gain, budget cost and platform alignment; the best one wins.
 */
public abstract class AbstractActor implements Actor {
  protected static final double W_OPINION = 1.0;
  protected static final double W_COST = 0.5;
  protected static final double W_ALIGN = 0.6;
  /** Proposals must beat holding still by this much. */
  protected static final double PROPOSAL_HURDLE = 0.25;

  protected final String id;
  protected final PolicyCatalog catalog;
  protected final double noise;

  protected AbstractActor(String id, PolicyCatalog catalog, double noise) {
    this.id = id;
    this.catalog = catalog;
    this.noise = Math.max(0.0, noise);
  }

  @Override
  public String id() { return id; }

  protected record Candidate(String label, double score, Intent intent) {}

  /**
   * Picks the highest-scoring candidate. Jitter is drawn in label order so the draw sequence
   * does not depend on how candidates were generated; exact ties use the same stream.
   */
  protected Intent choose(List<Candidate> candidates, RandomStream stream) {
    if (candidates.isEmpty()) {
      throw new IllegalStateException("No candidate actions for " + id);
    }
    List<Candidate> ordered = new ArrayList<>(candidates);
    ordered.sort(Comparator.comparing(Candidate::label));
    double best = Double.NEGATIVE_INFINITY;
    List<Candidate> top = new ArrayList<>();
    for (Candidate candidate : ordered) {
      double score = candidate.score() + (noise > 0 ? stream.uniform(-noise, noise) : 0.0);
      if (score > best) {
        best = score;
        top.clear();
        top.add(candidate);
      } else if (score == best) {
        top.add(candidate);
      }
    }
    Candidate winner = top.size() == 1 ? top.get(0) : top.get(stream.nextInt(top.size()));
    return winner.intent();
  }

  /** Public reward for a change: the region's current lean on the issue plus the declared opinion deltas. */
  protected static double opinionGain(WorldSnapshot snapshot, String region, String issue, double direction,
                                      EffectVector effect) {
    return snapshot.opinion(region, issue) * direction + effect.opinionMagnitude();
  }

  /** Mean of platform stance times regional opinion across all issues, in [-1, 1]. */
  protected static double platformFit(WorldSnapshot snapshot, Map<String, Double> platform, String region) {
    double sum = 0;
    for (String issue : Issues.ALL) {
      sum += platform.getOrDefault(issue, 0.0) * snapshot.opinion(region, issue);
    }
    return sum / Issues.ALL.size();
  }
}
