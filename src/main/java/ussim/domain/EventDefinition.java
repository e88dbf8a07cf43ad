package ussim.domain;

import java.util.List;

/**
 * Triggerable world event. Scheduled events fire in {@code month} (every year, or only in years
 * divisible by {@code yearModulo} when that is above one). An empty region list targets the
 * national region and every state.
 */
public record EventDefinition(String key, String name, String description, double weight, TriggerType trigger,
                              EventCondition condition, int month, int yearModulo, EffectVector effect,
                              List<String> regions, boolean recurring, int cooldownTurns,
                              List<Consequence> consequences) {
  public EventDefinition {
    if (key == null || key.isBlank()) throw new IllegalArgumentException("Event key is required");
    if (trigger == null) throw new IllegalArgumentException("Event trigger is required: " + key);
    if (trigger == TriggerType.CONDITIONAL && condition == null) {
      throw new IllegalArgumentException("Conditional event needs a condition: " + key);
    }
    if (trigger == TriggerType.SCHEDULED && (month < 1 || month > 12)) {
      throw new IllegalArgumentException("Scheduled event needs a month in 1..12: " + key);
    }
    if (weight < 0) throw new IllegalArgumentException("Event weight must be >= 0: " + key);
    if (cooldownTurns < 0) throw new IllegalArgumentException("Event cooldown must be >= 0: " + key);
    if (name == null || name.isBlank()) name = key;
    if (description == null) description = name;
    if (effect == null) effect = EffectVector.EMPTY;
    regions = regions == null ? List.of() : List.copyOf(regions);
    consequences = consequences == null ? List.of() : List.copyOf(consequences);
  }

  /** Ad-hoc event for a manual effect-vector trigger. */
  public static EventDefinition manual(String key, String description, EffectVector effect, List<String> regions) {
    return new EventDefinition(key, description, description, 0, TriggerType.MANUAL_ONLY, null, 0, 0,
        effect, regions, false, 0, List.of());
  }
}
