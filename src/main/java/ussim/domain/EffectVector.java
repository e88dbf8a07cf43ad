package ussim.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Structured set of numeric deltas applied atomically by a policy or an event.
 * Growth is in fractional points (0.01 = one point of GDP growth), unemployment and
 * inflation in percentage points, budget in billions (positive = more spending).
 */
public final class EffectVector {
  public static final EffectVector EMPTY = new EffectVector(0, 0, 0, 0, Map.of());

  private final double growth;
  private final double unemployment;
  private final double inflation;
  private final double budget;
  private final Map<String, Double> opinion;

  public EffectVector(double growth, double unemployment, double inflation, double budget,
                      Map<String, Double> opinion) {
    this.growth = growth;
    this.unemployment = unemployment;
    this.inflation = inflation;
    this.budget = budget;
    Map<String, Double> sorted = new TreeMap<>();
    if (opinion != null) {
      for (var entry : opinion.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) continue;
        if (entry.getValue() == 0.0) continue;
        sorted.put(entry.getKey(), entry.getValue());
      }
    }
    this.opinion = Collections.unmodifiableMap(sorted);
  }

  public static EffectVector opinionOnly(String issue, double delta) {
    return new EffectVector(0, 0, 0, 0, Map.of(issue, delta));
  }

  public double growth() { return growth; }
  public double unemployment() { return unemployment; }
  public double inflation() { return inflation; }
  public double budget() { return budget; }
  public Map<String, Double> opinion() { return opinion; }

  public double opinionDelta(String issue) {
    return opinion.getOrDefault(issue, 0.0);
  }

  public boolean hasEconomyEffect() {
    return growth != 0 || unemployment != 0 || inflation != 0 || budget != 0;
  }

  public boolean hasOpinionEffect() {
    return !opinion.isEmpty();
  }

  /** False when any delta is NaN or infinite. */
  public boolean isFinite() {
    if (!Double.isFinite(growth) || !Double.isFinite(unemployment) || !Double.isFinite(inflation)
        || !Double.isFinite(budget)) {
      return false;
    }
    for (double v : opinion.values()) {
      if (!Double.isFinite(v)) return false;
    }
    return true;
  }

  public double opinionMagnitude() {
    double sum = 0;
    for (double v : opinion.values()) sum += v;
    return sum;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EffectVector other)) return false;
    return Double.compare(growth, other.growth) == 0
        && Double.compare(unemployment, other.unemployment) == 0
        && Double.compare(inflation, other.inflation) == 0
        && Double.compare(budget, other.budget) == 0
        && opinion.equals(other.opinion);
  }

  @Override
  public int hashCode() {
    return Objects.hash(growth, unemployment, inflation, budget, opinion);
  }

  @Override
  public String toString() {
    return "EffectVector{growth=" + growth + ", unemployment=" + unemployment + ", inflation=" + inflation
        + ", budget=" + budget + ", opinion=" + opinion + "}";
  }
}
