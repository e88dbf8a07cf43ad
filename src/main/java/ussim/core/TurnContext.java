package ussim.core;

import ussim.agents.Intent;
import ussim.domain.EffectVector;
import ussim.domain.Election;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-turn scratch space shared by the phases of one turn: the pre-turn snapshot, the
 * collected intents, queued opinion effects and what the turn reports. Discarded on rollback.
 */
public class TurnContext {
  public record QueuedOpinion(String region, EffectVector effect, String source) {}

  private final int turn;
  private final int year;
  private final int month;
  private final WorldSnapshot snapshot;
  private final SortedMap<String, Intent> intents = new TreeMap<>();
  private final List<QueuedOpinion> opinionQueue = new ArrayList<>();
  private final List<TurnReport.ElectionSummary> elections = new ArrayList<>();
  private final List<String> enactedPolicies = new ArrayList<>();
  private final List<String> rejectedPolicies = new ArrayList<>();
  private final List<String> eventsFired = new ArrayList<>();
  private final List<String> faults = new ArrayList<>();

  public TurnContext(int turn, int year, int month, WorldSnapshot snapshot) {
    this.turn = turn;
    this.year = year;
    this.month = month;
    this.snapshot = snapshot;
  }

  public int turn() { return turn; }
  public int year() { return year; }
  public int month() { return month; }
  public WorldSnapshot snapshot() { return snapshot; }

  public SortedMap<String, Intent> intents() { return Collections.unmodifiableSortedMap(intents); }

  public void setIntents(SortedMap<String, Intent> collected) {
    intents.clear();
    intents.putAll(collected);
  }

  public void queueOpinion(List<String> regions, EffectVector effect, String source) {
    if (!effect.hasOpinionEffect()) return;
    for (String region : regions) {
      opinionQueue.add(new QueuedOpinion(region, effect, source));
    }
  }

  public List<QueuedOpinion> drainOpinionQueue() {
    List<QueuedOpinion> drained = new ArrayList<>(opinionQueue);
    opinionQueue.clear();
    return drained;
  }

  public void reportElection(Election election) {
    elections.add(new TurnReport.ElectionSummary(election.id(), election.kind().name(), election.year(),
        election.month(), election.seatTotals()));
  }

  public void reportEnacted(String policyId) { enactedPolicies.add(policyId); }
  public void reportRejected(String policyId) { rejectedPolicies.add(policyId); }
  public void reportEvent(String eventKey) { eventsFired.add(eventKey); }

  /** Records a non-fatal rejection with enough context to reproduce it. */
  public void reportFault(String actorId, String entityId, String reason) {
    String line = String.format("turn %d %04d-%02d actor=%s entity=%s: %s", turn, year, month,
        actorId == null ? "-" : actorId, entityId == null ? "-" : entityId, reason);
    faults.add(line);
    SimulationLogger.log("[Rejected] " + line);
  }

  public List<TurnReport.ElectionSummary> elections() { return Collections.unmodifiableList(elections); }
  public List<String> enactedPolicies() { return Collections.unmodifiableList(enactedPolicies); }
  public List<String> rejectedPolicies() { return Collections.unmodifiableList(rejectedPolicies); }
  public List<String> eventsFired() { return Collections.unmodifiableList(eventsFired); }
  public List<String> faults() { return Collections.unmodifiableList(faults); }
}
