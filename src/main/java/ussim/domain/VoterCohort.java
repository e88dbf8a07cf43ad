package ussim.domain;

/**
 * Slice of an electorate. {@code share} is its fraction of eligible voters, {@code turnout}
 * the fraction of it that votes; {@code lean} is the party it backs, null for unaligned voters.
 */
public record VoterCohort(String name, double share, String lean, double turnout) {
  /** Fraction of all eligible voters who turn out from this cohort. */
  public double weight() {
    return share * turnout;
  }
}
