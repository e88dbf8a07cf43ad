package ussim.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What an {@code advance} call did: elections resolved, policies enacted or rejected, events
 * fired and every rejected transition.
 */
public final class TurnReport {
  public record ElectionSummary(String electionId, String kind, int year, int month, Map<String, Integer> seatTotals) {}

  private final int startYear;
  private final int startMonth;
  private final int endYear;
  private final int endMonth;
  private final int turnsAdvanced;
  private final List<ElectionSummary> elections;
  private final List<String> enactedPolicies;
  private final List<String> rejectedPolicies;
  private final List<String> eventsFired;
  private final List<String> faults;

  private TurnReport(Builder b, int endYear, int endMonth) {
    this.startYear = b.startYear;
    this.startMonth = b.startMonth;
    this.endYear = endYear;
    this.endMonth = endMonth;
    this.turnsAdvanced = b.turnsAdvanced;
    this.elections = List.copyOf(b.elections);
    this.enactedPolicies = List.copyOf(b.enactedPolicies);
    this.rejectedPolicies = List.copyOf(b.rejectedPolicies);
    this.eventsFired = List.copyOf(b.eventsFired);
    this.faults = List.copyOf(b.faults);
  }

  public static TurnReport empty(int year, int month) {
    return new Builder(year, month).build(year, month);
  }

  public int startYear() { return startYear; }
  public int startMonth() { return startMonth; }
  public int endYear() { return endYear; }
  public int endMonth() { return endMonth; }
  public int turnsAdvanced() { return turnsAdvanced; }
  public List<ElectionSummary> elections() { return elections; }
  public List<String> enactedPolicies() { return enactedPolicies; }
  public List<String> rejectedPolicies() { return rejectedPolicies; }
  public List<String> eventsFired() { return eventsFired; }
  /** Non-fatal rejections recorded while advancing (intents, consequences). */
  public List<String> faults() { return faults; }

  public boolean isEmpty() {
    return turnsAdvanced == 0 && elections.isEmpty() && enactedPolicies.isEmpty()
        && rejectedPolicies.isEmpty() && eventsFired.isEmpty() && faults.isEmpty();
  }

  public long electionsOfKind(String kind) {
    return elections.stream().filter(e -> e.kind().equals(kind)).count();
  }

  @Override
  public String toString() {
    return "TurnReport{" + String.format("%04d-%02d..%04d-%02d", startYear, startMonth, endYear, endMonth)
        + ", turns=" + turnsAdvanced + ", elections=" + elections.size() + ", enacted=" + enactedPolicies.size()
        + ", rejected=" + rejectedPolicies.size() + ", events=" + eventsFired.size() + ", faults=" + faults.size() + "}";
  }

  static final class Builder {
    private final int startYear;
    private final int startMonth;
    private int turnsAdvanced;
    private final List<ElectionSummary> elections = new ArrayList<>();
    private final List<String> enactedPolicies = new ArrayList<>();
    private final List<String> rejectedPolicies = new ArrayList<>();
    private final List<String> eventsFired = new ArrayList<>();
    private final List<String> faults = new ArrayList<>();

    Builder(int startYear, int startMonth) {
      this.startYear = startYear;
      this.startMonth = startMonth;
    }

    void merge(TurnContext turn) {
      turnsAdvanced++;
      elections.addAll(turn.elections());
      enactedPolicies.addAll(turn.enactedPolicies());
      rejectedPolicies.addAll(turn.rejectedPolicies());
      eventsFired.addAll(turn.eventsFired());
      faults.addAll(turn.faults());
    }

    TurnReport build(int endYear, int endMonth) {
      return new TurnReport(this, endYear, endMonth);
    }
  }
}
