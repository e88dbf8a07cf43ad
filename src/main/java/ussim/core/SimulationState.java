package ussim.core;

import ussim.domain.Chamber;
import ussim.domain.Election;
import ussim.domain.Nation;
import ussim.domain.PoliticalParty;
import ussim.domain.Policy;
import ussim.domain.Regions;
import ussim.domain.State;
import ussim.events.EventLedger;
import ussim.opinion.PublicOpinionTracker;
import ussim.random.RandomStreams;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate root of one simulation. Owns every entity exclusively and is passed explicitly to
 * each phase; several instances can live side by side in one process.
 */
public class SimulationState {
  private int year;
  private int month;
  private int completedTurns;

  private Nation nation;
  private Map<String, PoliticalParty> parties = new TreeMap<>();
  private Map<String, State> states = new TreeMap<>();
  private Map<Chamber, Integer> chamberSizes = new EnumMap<>(Chamber.class);
  private PublicOpinionTracker opinion;
  private Map<String, Policy> policies = new TreeMap<>();
  private List<Election> elections = new ArrayList<>();
  private EventLedger events = new EventLedger();
  private RandomStreams streams;
  private long policySequence;
  private SimulationLog log = new SimulationLog();

  public SimulationState(int year, int month, Nation nation, PublicOpinionTracker opinion, RandomStreams streams) {
    if (month < 1 || month > 12) throw new IllegalArgumentException("month must be in 1..12: " + month);
    this.year = year;
    this.month = month;
    this.nation = nation;
    this.opinion = opinion;
    this.streams = streams;
  }

  public int year() { return year; }
  public int month() { return month; }
  public int completedTurns() { return completedTurns; }

  /** Turn number of the next turn to be processed (1-based). */
  public int currentTurn() { return completedTurns + 1; }

  public void advanceClock() {
    month++;
    if (month > 12) {
      month = 1;
      year++;
    }
    completedTurns++;
  }

  void restoreClock(int completedTurns) {
    this.completedTurns = completedTurns;
  }

  public Nation nation() { return nation; }

  public Map<String, PoliticalParty> parties() { return Collections.unmodifiableMap(parties); }

  public void addParty(PoliticalParty party) {
    if (parties.putIfAbsent(party.id(), party) != null) {
      throw new ConfigurationFault(party.id(), "Duplicate party");
    }
  }

  public PoliticalParty party(String id) {
    PoliticalParty party = parties.get(id);
    if (party == null) throw new IllegalArgumentException("Unknown party: " + id);
    return party;
  }

  public Map<String, State> states() { return Collections.unmodifiableMap(states); }

  public void addState(State state) {
    if (states.putIfAbsent(state.id(), state) != null) {
      throw new ConfigurationFault(state.id(), "Duplicate state");
    }
  }

  public State state(String id) {
    State state = states.get(id);
    if (state == null) throw new IllegalArgumentException("Unknown state: " + id);
    return state;
  }

  /** The national region followed by every state region, in id order. */
  public List<String> allRegions() {
    List<String> regions = new ArrayList<>();
    regions.add(Regions.NATIONAL);
    regions.addAll(states.keySet());
    return regions;
  }

  public int chamberSize(Chamber chamber) {
    return chamberSizes.getOrDefault(chamber, 0);
  }

  public void setChamberSize(Chamber chamber, int size) {
    chamberSizes.put(chamber, size);
  }

  public PublicOpinionTracker opinion() { return opinion; }

  public Collection<Policy> policies() { return Collections.unmodifiableCollection(policies.values()); }

  public Policy policy(String id) { return policies.get(id); }

  public void addPolicy(Policy policy) {
    if (policies.putIfAbsent(policy.id(), policy) != null) {
      throw new IllegalStateException("Duplicate policy id " + policy.id());
    }
  }

  public List<Policy> pendingPolicies() {
    List<Policy> pending = new ArrayList<>();
    for (Policy policy : policies.values()) {
      if (policy.isPending()) pending.add(policy);
    }
    return pending;
  }

  public String nextPolicyId() {
    policySequence++;
    return String.format("P-%06d", policySequence);
  }

  public long policySequence() { return policySequence; }

  void restorePolicySequence(long value) { this.policySequence = value; }

  public List<Election> elections() { return Collections.unmodifiableList(elections); }

  public void recordElection(Election election) {
    elections.add(election);
  }

  public EventLedger events() { return events; }
  public RandomStreams streams() { return streams; }
  public SimulationLog log() { return log; }

  public void log(String entry) {
    log.add(year, month, entry);
  }

  /** Party holding the most seats in the chamber; ties go to the lexicographically-first id. */
  public String chamberControl(Chamber chamber) {
    String best = null;
    int bestSeats = -1;
    for (PoliticalParty party : parties.values()) {
      if (party.seats(chamber) > bestSeats) {
        best = party.id();
        bestSeats = party.seats(chamber);
      }
    }
    return best;
  }

  /**
   * Replaces the whole content with {@code other}'s. Used by snapshot loading and by turn
   * rollback; {@code other} must not be used afterwards.
   */
  public void replaceWith(SimulationState other) {
    this.year = other.year;
    this.month = other.month;
    this.completedTurns = other.completedTurns;
    this.nation = other.nation;
    this.parties = other.parties;
    this.states = other.states;
    this.chamberSizes = other.chamberSizes;
    this.opinion = other.opinion;
    this.policies = other.policies;
    this.elections = other.elections;
    this.events = other.events;
    this.streams = other.streams;
    this.policySequence = other.policySequence;
    this.log = other.log;
  }

  /** Restores the counters the public constructor cannot take. */
  public static void restoreCounters(SimulationState state, int completedTurns, long policySequence, List<String> logLines) {
    state.restoreClock(completedTurns);
    state.restorePolicySequence(policySequence);
    state.log.restore(logLines);
  }
}
