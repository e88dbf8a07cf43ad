package ussim.domain;

/**
 * Catalog entry a proposal is instantiated from. Manual proposals use ad-hoc templates.
 *
 * @param direction +1 expands action on the issue, -1 rolls it back
 * @param cost billions per enactment; negative means savings
 */
public record PolicyTemplate(String key, String title, PolicyLevel level, String issue, double direction,
                             double cost, EffectVector effect) {
  public PolicyTemplate {
    if (key == null || key.isBlank()) throw new IllegalArgumentException("Policy template key is required");
    if (level == null) throw new IllegalArgumentException("Policy template level is required: " + key);
    if (issue == null || issue.isBlank()) throw new IllegalArgumentException("Policy template issue is required: " + key);
    if (direction < -1.0 || direction > 1.0) {
      throw new IllegalArgumentException("Policy direction must be within [-1, 1]: " + key);
    }
    if (title == null || title.isBlank()) title = key;
    if (effect == null) effect = EffectVector.EMPTY;
  }
}
