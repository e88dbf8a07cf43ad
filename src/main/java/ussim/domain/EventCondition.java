package ussim.domain;

/**
 * Threshold over a snapshot metric, e.g. {@code deficit} of state {@code CA} above 5.
 * A null region means the national value. Metrics: growth, unemployment, inflation,
 * deficit, opinion:&lt;issue&gt;, approval:&lt;party&gt;.
 */
public record EventCondition(String metric, String region, boolean above, double threshold) {
  public EventCondition {
    if (metric == null || metric.isBlank()) throw new IllegalArgumentException("Condition metric is required");
  }
}
