package ussim.config;

import ussim.domain.EventDefinition;
import ussim.domain.TriggerType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class EventCatalog {
  private final Map<String, EventDefinition> events = new TreeMap<>();

  public EventCatalog(Collection<EventDefinition> events) {
    for (EventDefinition event : events) {
      if (this.events.putIfAbsent(event.key(), event) != null) {
        throw new IllegalArgumentException("Duplicate event: " + event.key());
      }
    }
  }

  public static EventCatalog empty() {
    return new EventCatalog(List.of());
  }

  public EventDefinition get(String key) {
    return events.get(key);
  }

  public Collection<EventDefinition> all() {
    return Collections.unmodifiableCollection(events.values());
  }

  public List<EventDefinition> byTrigger(TriggerType trigger) {
    List<EventDefinition> out = new ArrayList<>();
    for (EventDefinition event : events.values()) {
      if (event.trigger() == trigger) out.add(event);
    }
    return out;
  }
}
