package ussim.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class State {
  public static final double GOVERNOR_APPROVAL_BASELINE = 50.0;
  public static final double LEGISLATURE_APPROVAL_BASELINE = 40.0;

  private final String id;
  private final String name;
  private final long population;
  private final Map<String, Double> lean; // party id -> baseline statewide share, sums to 1
  private String governorParty;
  private final int legislatureSize;
  private final Map<String, Integer> legislature = new TreeMap<>();
  private List<VoterCohort> cohorts = List.of();
  private double governorApproval = GOVERNOR_APPROVAL_BASELINE;
  private double legislatureApproval = LEGISLATURE_APPROVAL_BASELINE;

  // Public finance, billions.
  private double revenue;
  private double spending;
  private double taxRate;

  private double gdp;
  private double unemployment;
  private double inflation;

  private final List<String> enactedPolicyIds = new ArrayList<>();
  private final Map<String, Double> campaignSpend = new TreeMap<>();
  private final List<District> districts = new ArrayList<>();
  private final List<SenateSeat> senateSeats = new ArrayList<>();

  public State(String id, String name, long population, Map<String, Double> lean, String governorParty,
               int legislatureSize, Map<String, Integer> legislature) {
    this.id = id;
    this.name = name;
    this.population = population;
    this.lean = Collections.unmodifiableMap(new TreeMap<>(lean));
    this.governorParty = governorParty;
    this.legislatureSize = legislatureSize;
    this.legislature.putAll(legislature);
  }

  public String id() { return id; }
  public String name() { return name; }
  public long population() { return population; }
  public Map<String, Double> lean() { return lean; }

  public String governorParty() { return governorParty; }
  public void setGovernorParty(String governorParty) { this.governorParty = governorParty; }

  public List<VoterCohort> cohorts() { return cohorts; }
  public void setCohorts(List<VoterCohort> cohorts) { this.cohorts = List.copyOf(cohorts); }

  public double governorApproval() { return governorApproval; }
  public void setGovernorApproval(double approval) { this.governorApproval = Nation.clampApproval(approval); }
  public double legislatureApproval() { return legislatureApproval; }
  public void setLegislatureApproval(double approval) { this.legislatureApproval = Nation.clampApproval(approval); }

  public int legislatureSize() { return legislatureSize; }
  public Map<String, Integer> legislature() { return Collections.unmodifiableMap(legislature); }

  public void setLegislature(Map<String, Integer> seats) {
    legislature.clear();
    legislature.putAll(seats);
  }

  public String legislatureMajority() {
    String best = null;
    int bestSeats = -1;
    for (var entry : legislature.entrySet()) {
      if (entry.getValue() > bestSeats) {
        best = entry.getKey();
        bestSeats = entry.getValue();
      }
    }
    return best;
  }

  public double revenue() { return revenue; }
  public void setRevenue(double revenue) { this.revenue = revenue; }
  public double spending() { return spending; }
  public void setSpending(double spending) { this.spending = spending; }
  public double taxRate() { return taxRate; }
  public void setTaxRate(double taxRate) { this.taxRate = taxRate; }

  public double deficit() {
    return spending - revenue;
  }

  public double gdp() { return gdp; }
  public void setGdp(double gdp) { this.gdp = gdp; }
  public double unemployment() { return unemployment; }
  public void setUnemployment(double unemployment) { this.unemployment = unemployment; }
  public double inflation() { return inflation; }
  public void setInflation(double inflation) { this.inflation = inflation; }

  /** Local economy part of an effect. Budget deltas land on state spending. */
  public void applyEconomy(EffectVector effect) {
    gdp = Math.max(0.0, gdp * (1.0 + effect.growth()));
    unemployment = Math.max(Nation.MIN_UNEMPLOYMENT, Math.min(Nation.MAX_UNEMPLOYMENT, unemployment + effect.unemployment()));
    inflation = Math.max(0.0, Math.min(Nation.MAX_INFLATION, inflation + effect.inflation()));
    spending += effect.budget();
  }

  public List<String> enactedPolicyIds() { return Collections.unmodifiableList(enactedPolicyIds); }
  public void recordEnactedPolicy(String policyId) { enactedPolicyIds.add(policyId); }

  public Map<String, Double> campaignSpend() { return Collections.unmodifiableMap(campaignSpend); }

  public void addCampaignSpend(String partyId, double amount) {
    campaignSpend.merge(partyId, amount, Double::sum);
  }

  public void clearCampaignSpend() {
    campaignSpend.clear();
  }

  public List<District> districts() { return districts; }
  public List<SenateSeat> senateSeats() { return senateSeats; }
}
