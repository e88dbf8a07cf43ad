package ussim.domain;

/**
 * Weighted roll call in one chamber. Passing requires the yes share to strictly exceed the threshold.
 */
public record VoteTally(String chamber, double yes, double no, double threshold) {
  public double yesShare() {
    double total = yes + no;
    return total <= 0 ? 0.0 : yes / total;
  }

  public boolean passed() {
    return yes + no > 0 && yesShare() > threshold;
  }

  @Override
  public String toString() {
    return String.format("%s yes=%.2f no=%.2f (need >%.3f)", chamber, yes, no, threshold);
  }
}
