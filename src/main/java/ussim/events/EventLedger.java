package ussim.events;

import ussim.domain.EffectVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Persistent event bookkeeping: cooldowns, retired one-shots, delayed chain events, manual
 * triggers queued between turns, and the most recent fired keys.
 */
public class EventLedger {
  public static final int RECENT_LIMIT = 12;

  public record ScheduledEvent(String key, int fireTurn) {}

  /** A queued manual trigger; {@code key} names a catalog event unless {@code effect} is set. */
  public record ManualTrigger(String key, String description, EffectVector effect, List<String> regions) {
    public ManualTrigger {
      regions = regions == null ? List.of() : List.copyOf(regions);
    }

    public boolean adHoc() {
      return effect != null;
    }
  }

  private final Map<String, Integer> cooldowns = new TreeMap<>();
  private final Set<String> retired = new TreeSet<>();
  private final List<ScheduledEvent> scheduled = new ArrayList<>();
  private final List<ManualTrigger> manualQueue = new ArrayList<>();
  private final List<String> recent = new ArrayList<>();

  public Map<String, Integer> cooldowns() { return Collections.unmodifiableMap(cooldowns); }
  public Set<String> retired() { return Collections.unmodifiableSet(retired); }
  public List<ScheduledEvent> scheduled() { return Collections.unmodifiableList(scheduled); }
  public List<ManualTrigger> manualQueue() { return Collections.unmodifiableList(manualQueue); }
  public List<String> recent() { return Collections.unmodifiableList(recent); }

  public boolean isAvailable(String key) {
    return !retired.contains(key) && cooldowns.getOrDefault(key, 0) <= 0;
  }

  public void retire(String key) {
    retired.add(key);
  }

  public void startCooldown(String key, int turns) {
    if (turns > 0) cooldowns.put(key, turns);
  }

  /** Counts every cooldown down by one turn; expired entries are dropped. */
  public void tickCooldowns() {
    cooldowns.replaceAll((key, turns) -> turns - 1);
    cooldowns.values().removeIf(turns -> turns <= 0);
  }

  public void schedule(String key, int fireTurn) {
    scheduled.add(new ScheduledEvent(key, fireTurn));
  }

  /** Removes and returns chain events due on or before {@code turn}, in scheduling order. */
  public List<ScheduledEvent> takeDue(int turn) {
    List<ScheduledEvent> due = new ArrayList<>();
    scheduled.removeIf(event -> {
      if (event.fireTurn() <= turn) {
        due.add(event);
        return true;
      }
      return false;
    });
    return due;
  }

  public void enqueueManual(ManualTrigger trigger) {
    manualQueue.add(trigger);
  }

  public List<ManualTrigger> drainManual() {
    List<ManualTrigger> drained = new ArrayList<>(manualQueue);
    manualQueue.clear();
    return drained;
  }

  public void recordFired(String key) {
    recent.add(key);
    while (recent.size() > RECENT_LIMIT) {
      recent.remove(0);
    }
  }

  public void restore(Map<String, Integer> cooldowns, Set<String> retired, List<ScheduledEvent> scheduled,
                      List<ManualTrigger> manual, List<String> recent) {
    this.cooldowns.clear();
    this.cooldowns.putAll(cooldowns);
    this.retired.clear();
    this.retired.addAll(retired);
    this.scheduled.clear();
    this.scheduled.addAll(scheduled);
    this.manualQueue.clear();
    this.manualQueue.addAll(manual);
    this.recent.clear();
    this.recent.addAll(recent);
  }
}
