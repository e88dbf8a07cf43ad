package ussim.core;

import ussim.domain.Chamber;
import ussim.domain.Nation;
import ussim.domain.PoliticalParty;
import ussim.domain.Policy;
import ussim.domain.PolicyLevel;
import ussim.domain.Regions;
import ussim.domain.State;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only view of the simulation frozen at the start of a turn. AI decisions and event
 * triggers read only this, so nothing they compute can observe same-turn effects.
 */
public final class WorldSnapshot {
  public record PartyView(String id, Map<String, Double> platform, double treasury, double approval,
                          int houseSeats, int senateSeats) {
    public double stanceOn(String issue) {
      return platform.getOrDefault(issue, 0.0);
    }
  }

  public record StateView(String id, long population, Map<String, Double> lean, String governorParty,
                          Map<String, Integer> legislature, int legislatureSize, double revenue, double spending,
                          double taxRate, double unemployment, double inflation, Map<String, Double> campaignSpend,
                          double governorApproval, double legislatureApproval) {
    public double deficit() {
      return spending - revenue;
    }
  }

  private final int turn;
  private final int year;
  private final int month;
  private final String presidentParty;
  private final double growth;
  private final double unemployment;
  private final double inflation;
  private final double federalDeficit;
  private final double presidentApproval;
  private final double congressApproval;
  private final Map<String, PartyView> parties;
  private final Map<String, StateView> states;
  private final Map<String, Map<String, Double>> opinion;
  private final Set<String> pendingProposals;
  private final List<String> recentEvents;

  private WorldSnapshot(SimulationState state, int turn) {
    this.turn = turn;
    this.year = state.year();
    this.month = state.month();
    Nation nation = state.nation();
    this.presidentParty = nation.presidentParty();
    this.growth = nation.growth();
    this.unemployment = nation.unemployment();
    this.inflation = nation.inflation();
    this.federalDeficit = nation.federalDeficit();
    this.presidentApproval = nation.presidentApproval();
    this.congressApproval = nation.congressApproval();

    Map<String, PartyView> partyViews = new TreeMap<>();
    for (PoliticalParty p : state.parties().values()) {
      partyViews.put(p.id(), new PartyView(p.id(), p.platform(), p.treasury(), p.nationalApproval(),
          p.seats(Chamber.HOUSE), p.seats(Chamber.SENATE)));
    }
    this.parties = Collections.unmodifiableMap(partyViews);

    Map<String, StateView> stateViews = new TreeMap<>();
    for (State s : state.states().values()) {
      stateViews.put(s.id(), new StateView(s.id(), s.population(), s.lean(), s.governorParty(),
          Collections.unmodifiableMap(new TreeMap<>(s.legislature())), s.legislatureSize(), s.revenue(), s.spending(), s.taxRate(),
          s.unemployment(), s.inflation(), Collections.unmodifiableMap(new TreeMap<>(s.campaignSpend())),
          s.governorApproval(), s.legislatureApproval()));
    }
    this.states = Collections.unmodifiableMap(stateViews);
    this.opinion = state.opinion().entries();

    Set<String> pending = new TreeSet<>();
    for (Policy policy : state.pendingPolicies()) {
      pending.add(proposalKey(policy.level(), policy.stateId(), policy.key()));
    }
    this.pendingProposals = Collections.unmodifiableSet(pending);
    this.recentEvents = List.copyOf(state.events().recent());
  }

  public static WorldSnapshot capture(SimulationState state, int turn) {
    return new WorldSnapshot(state, turn);
  }

  public static String proposalKey(PolicyLevel level, String stateId, String templateKey) {
    return level + "|" + (stateId == null ? "" : stateId) + "|" + templateKey;
  }

  public int turn() { return turn; }
  public int year() { return year; }
  public int month() { return month; }
  public String presidentParty() { return presidentParty; }
  public double growth() { return growth; }
  public double unemployment() { return unemployment; }
  public double inflation() { return inflation; }
  public double federalDeficit() { return federalDeficit; }
  public double presidentApproval() { return presidentApproval; }
  public double congressApproval() { return congressApproval; }
  public Map<String, PartyView> parties() { return parties; }
  public Map<String, StateView> states() { return states; }
  public List<String> recentEvents() { return recentEvents; }

  public PartyView party(String id) { return parties.get(id); }
  public StateView state(String id) { return states.get(id); }

  public double opinion(String region, String issue) {
    Map<String, Double> byIssue = opinion.get(region);
    if (byIssue == null) return 0.0;
    return byIssue.getOrDefault(issue, 0.0);
  }

  public boolean isPending(PolicyLevel level, String stateId, String templateKey) {
    return pendingProposals.contains(proposalKey(level, stateId, templateKey));
  }

  /** Months from now until the next even-year November election month (0 when it is this month). */
  public int monthsUntilElection() {
    int y = year;
    int m = month;
    int months = 0;
    while (!(m == 11 && y % 2 == 0)) {
      m++;
      if (m > 12) {
        m = 1;
        y++;
      }
      months++;
    }
    return months;
  }

  /**
   * Metric lookup for event conditions. A null or national region reads the national value.
   * Returns NaN for unknown metrics or regions so conditions on them never hold.
   */
  public double metric(String metric, String region) {
    boolean national = region == null || region.isBlank() || Regions.NATIONAL.equals(region);
    StateView sv = national ? null : states.get(region);
    if (!national && sv == null) return Double.NaN;
    if (metric.startsWith("opinion:")) {
      return opinion(national ? Regions.NATIONAL : region, metric.substring("opinion:".length()));
    }
    if (metric.startsWith("approval:")) {
      PartyView party = parties.get(metric.substring("approval:".length()));
      return party == null ? Double.NaN : party.approval();
    }
    return switch (metric) {
      case "growth" -> national ? growth : Double.NaN;
      case "unemployment" -> national ? unemployment : sv.unemployment();
      case "inflation" -> national ? inflation : sv.inflation();
      case "deficit" -> national ? federalDeficit : sv.deficit();
      case "president_approval" -> national ? presidentApproval : Double.NaN;
      case "congress_approval" -> national ? congressApproval : Double.NaN;
      case "governor_approval" -> national ? Double.NaN : sv.governorApproval();
      case "legislature_approval" -> national ? Double.NaN : sv.legislatureApproval();
      default -> Double.NaN;
    };
  }
}
