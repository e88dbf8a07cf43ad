package ussim.events;

import ussim.core.WorldSnapshot;
import ussim.domain.EventCondition;
import ussim.domain.EventDefinition;
import ussim.domain.TriggerType;

/**
 * Trigger predicates. They read only the pre-turn snapshot and have no side effects.
 */
public final class EventTriggers {
  private EventTriggers() {}

  public static boolean isTriggered(EventDefinition event, WorldSnapshot snapshot) {
    if (event.trigger() == TriggerType.CONDITIONAL) {
      return conditionHolds(event.condition(), snapshot);
    }
    if (event.trigger() == TriggerType.SCHEDULED) {
      return scheduledDue(event, snapshot.year(), snapshot.month());
    }
    return false;
  }

  /** False for metrics or regions the snapshot does not know. */
  public static boolean conditionHolds(EventCondition condition, WorldSnapshot snapshot) {
    double value = snapshot.metric(condition.metric(), condition.region());
    if (Double.isNaN(value)) return false;
    return condition.above() ? value > condition.threshold() : value < condition.threshold();
  }

  public static boolean scheduledDue(EventDefinition event, int year, int month) {
    if (event.month() != month) return false;
    return event.yearModulo() <= 1 || Math.floorMod(year, event.yearModulo()) == 0;
  }
}
