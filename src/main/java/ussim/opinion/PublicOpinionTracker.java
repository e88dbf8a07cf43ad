package ussim.opinion;

import ussim.domain.EffectVector;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps (region, issue) to an approval value in [{@link #MIN}, {@link #MAX}]. Every update clamps;
 * {@link #decayStep()} pulls all entries toward the baseline in one completed pass.
 */
public class PublicOpinionTracker {
  public static final double MIN = -1.0;
  public static final double MAX = 1.0;
  public static final double BASELINE = 0.0;

  private final double decayRate;
  private final double maxDelta;
  private Map<String, Map<String, Double>> values = new TreeMap<>();

  public PublicOpinionTracker(double decayRate, double maxDelta) {
    if (decayRate < 0 || decayRate > 1) throw new IllegalArgumentException("decayRate must be in [0, 1]");
    if (maxDelta <= 0) throw new IllegalArgumentException("maxDelta must be positive");
    this.decayRate = decayRate;
    this.maxDelta = maxDelta;
  }

  public double decayRate() { return decayRate; }
  public double maxDelta() { return maxDelta; }

  public double get(String region, String issue) {
    Map<String, Double> byIssue = values.get(region);
    if (byIssue == null) return BASELINE;
    return byIssue.getOrDefault(issue, BASELINE);
  }

  /** Adds a delta bounded by {@code maxDelta}; the result is clamped to the opinion range. */
  public double apply(double delta, String region, String issue) {
    if (region == null || issue == null) throw new IllegalArgumentException("region and issue are required");
    if (Double.isNaN(delta)) throw new IllegalArgumentException("Opinion delta is NaN for " + region + "/" + issue);
    double bounded = Math.max(-maxDelta, Math.min(maxDelta, delta));
    double next = clamp(get(region, issue) + bounded);
    values.computeIfAbsent(region, ignored -> new TreeMap<>()).put(issue, next);
    return next;
  }

  public void apply(EffectVector effect, String region) {
    for (var entry : effect.opinion().entrySet()) {
      apply(entry.getValue(), region, entry.getKey());
    }
  }

  public void decayStep() {
    Map<String, Map<String, Double>> next = new TreeMap<>();
    for (var region : values.entrySet()) {
      Map<String, Double> byIssue = new TreeMap<>();
      for (var entry : region.getValue().entrySet()) {
        double v = entry.getValue();
        byIssue.put(entry.getKey(), clamp(v - decayRate * (v - BASELINE)));
      }
      next.put(region.getKey(), byIssue);
    }
    values = next;
  }

  /** Used when restoring a snapshot; out-of-range values are rejected rather than clamped. */
  public void set(String region, String issue, double value) {
    if (Double.isNaN(value) || value < MIN || value > MAX) {
      throw new IllegalArgumentException("Opinion " + region + "/" + issue + " out of bounds: " + value);
    }
    values.computeIfAbsent(region, ignored -> new TreeMap<>()).put(issue, value);
  }

  public Map<String, Map<String, Double>> entries() {
    Map<String, Map<String, Double>> copy = new TreeMap<>();
    for (var region : values.entrySet()) {
      copy.put(region.getKey(), Collections.unmodifiableMap(new TreeMap<>(region.getValue())));
    }
    return Collections.unmodifiableMap(copy);
  }

  public PublicOpinionTracker copy() {
    PublicOpinionTracker copy = new PublicOpinionTracker(decayRate, maxDelta);
    for (var region : values.entrySet()) {
      copy.values.put(region.getKey(), new TreeMap<>(region.getValue()));
    }
    return copy;
  }

  private static double clamp(double value) {
    return Math.max(MIN, Math.min(MAX, value));
  }
}
