package ussim.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SimulationLog keeps the dated, human-readable history of a run. Only the most
 * recent {@link #MAX_ENTRIES} lines are retained; the tail is persisted with the snapshot.
 */
public class SimulationLog {
  public static final int MAX_ENTRIES = 200;

  private final List<String> entries = new ArrayList<>();

  public void add(int year, int month, String entry) {
    if (entry == null || entry.isBlank()) return;
    String line = String.format("[%04d-%02d] %s", year, month, entry.trim());
    entries.add(line);
    while (entries.size() > MAX_ENTRIES) {
      entries.remove(0);
    }
  }

  void restore(List<String> lines) {
    entries.clear();
    for (String line : lines) {
      if (line == null || line.isBlank()) continue;
      entries.add(line);
    }
    while (entries.size() > MAX_ENTRIES) {
      entries.remove(0);
    }
  }

  public List<String> entries() {
    return Collections.unmodifiableList(entries);
  }

  public List<String> tail(int count) {
    int from = Math.max(0, entries.size() - Math.max(0, count));
    return List.copyOf(entries.subList(from, entries.size()));
  }
}
