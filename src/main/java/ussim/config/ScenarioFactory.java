package ussim.config;

import ussim.core.ConfigurationFault;
import ussim.core.SimulationState;
import ussim.domain.Chamber;
import ussim.domain.District;
import ussim.domain.Nation;
import ussim.domain.PoliticalParty;
import ussim.domain.SenateSeat;
import ussim.domain.State;
import ussim.domain.VoterCohort;
import ussim.elections.ElectionScheduler;
import ussim.elections.VoterModel;
import ussim.opinion.PublicOpinionTracker;
import ussim.random.RandomStream;
import ussim.random.RandomStreams;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the initial world from a scenario document: parties, states with their voter cohorts
 * and House districts, two staggered Senate seats each, legislatures and budgets.
 */
public class ScenarioFactory {
  public static final String STREAM_KEY = "scenario";
  static final double DISTRICT_SPREAD = 0.08;
  static final double MIN_LEAN = 0.01;
  static final double COHORT_SPREAD = 0.05;
  static final double MIN_COHORT_SHARE = 0.05;
  static final double MAX_COHORT_SHARE = 0.9;
  public static final double DEFAULT_TURNOUT = 0.6;

  private final CatalogLoader loader = new CatalogLoader();

  public SimulationState defaultScenario(SimulationConfig config) {
    return build(loader.read(config.scenarioPath(), ScenarioConfig.class), config);
  }

  public SimulationState build(ScenarioConfig sc, SimulationConfig config) {
    if (sc == null || sc.parties == null || sc.parties.isEmpty()) {
      throw new ConfigurationFault(null, "Scenario defines no parties");
    }
    if (sc.states == null || sc.states.isEmpty()) {
      throw new ConfigurationFault(null, "Scenario defines no states");
    }
    NationalConfig nc = sc.national == null ? new NationalConfig() : sc.national;
    Nation nation = new Nation(sc.president, nc.federalRevenue, nc.federalSpending, nc.federalTaxRate,
        nc.growth, nc.unemployment, nc.inflation);
    nation.setPresidentApproval(nc.presidentApproval);
    nation.setCongressApproval(nc.congressApproval);
    nation.setCourtLean(nc.courtLean);
    RandomStreams streams = new RandomStreams(config.seed());
    SimulationState state = new SimulationState(config.startYear(), config.startMonth(), nation,
        new PublicOpinionTracker(config.opinionDecayRate(), config.opinionMaxDelta()), streams);

    for (PartyConfig pc : sc.parties) {
      state.addParty(new PoliticalParty(pc.id, pc.name == null ? pc.id : pc.name,
          pc.platform == null ? Map.of() : pc.platform, pc.treasury, pc.approval));
    }

    RandomStream stream = streams.open(STREAM_KEY, 0);
    List<StateConfig> ordered = new ArrayList<>(sc.states);
    ordered.sort((a, b) -> String.valueOf(a.id).compareTo(String.valueOf(b.id)));
    int index = 0;
    int houseSize = 0;
    for (StateConfig stc : ordered) {
      if (stc.id == null || stc.id.isBlank()) throw new ConfigurationFault(null, "State without id");
      boolean configuredCohorts = stc.cohorts != null && !stc.cohorts.isEmpty();
      if (!configuredCohorts && (stc.lean == null || stc.lean.isEmpty())) {
        throw new ConfigurationFault(stc.id, "State without party lean or voter cohorts");
      }
      if (stc.districts < 1) throw new ConfigurationFault(stc.id, "State needs at least one House district");
      List<VoterCohort> cohorts = configuredCohorts ? readCohorts(stc.cohorts, stc.id) : null;
      Map<String, Double> lean = configuredCohorts
          ? normalize(VoterModel.cohortLean(cohorts, Map.of()), stc.id) : normalize(stc.lean, stc.id);
      if (!configuredCohorts) {
        cohorts = defaultCohorts(lean);
      }
      String favourite = VoterModel.pickWinner(lean, null);
      int legislatureSize = stc.legislatureSize > 0 ? stc.legislatureSize : sc.legislatureSize;
      State st = new State(stc.id, stc.name == null ? stc.id : stc.name, stc.population, lean, favourite,
          legislatureSize, VoterModel.allocateSeats(lean, legislatureSize));
      double taxRate = stc.taxRate > 0 ? stc.taxRate : sc.stateTaxRate;
      st.setGdp(stc.population * sc.gdpPerCapita);
      st.setTaxRate(taxRate);
      st.setRevenue(taxRate * st.gdp());
      st.setSpending(st.revenue() * sc.spendingRatio);
      st.setUnemployment(nc.unemployment);
      st.setInflation(nc.inflation);
      st.setCohorts(cohorts);

      for (int d = 1; d <= stc.districts; d++) {
        List<VoterCohort> districtCohorts;
        Map<String, Double> districtLean;
        if (configuredCohorts) {
          districtCohorts = perturbCohorts(cohorts, stream);
          districtLean = normalize(VoterModel.cohortLean(districtCohorts, Map.of()), stc.id);
        } else {
          districtLean = perturb(lean, stream);
          districtCohorts = defaultCohorts(districtLean);
        }
        District district = new District(String.format("%s-%02d", stc.id, d), stc.id, districtLean,
            VoterModel.pickWinner(districtLean, null));
        district.setCohorts(districtCohorts);
        st.districts().add(district);
      }
      houseSize += stc.districts;
      st.senateSeats().add(new SenateSeat(stc.id + "-S1", stc.id, (index % 3) + 1, favourite));
      st.senateSeats().add(new SenateSeat(stc.id + "-S2", stc.id, ((index + 1) % 3) + 1, favourite));
      state.addState(st);
      index++;
    }
    state.setChamberSize(Chamber.HOUSE, houseSize);
    state.setChamberSize(Chamber.SENATE, 2 * ordered.size());

    if (sc.opinion != null) {
      for (var region : sc.opinion.entrySet()) {
        for (var entry : region.getValue().entrySet()) {
          try {
            state.opinion().set(region.getKey(), entry.getKey(), entry.getValue());
          } catch (IllegalArgumentException e) {
            throw new ConfigurationFault(region.getKey(), e.getMessage(), e);
          }
        }
      }
    }

    ScenarioValidator.validate(state);
    for (Chamber chamber : Chamber.values()) {
      ElectionScheduler.recount(state, chamber, 0, "scenario");
    }
    return state;
  }

  /** One cohort per party with the party's lean as its share and a uniform turnout. */
  static List<VoterCohort> defaultCohorts(Map<String, Double> lean) {
    List<VoterCohort> cohorts = new ArrayList<>();
    for (var entry : lean.entrySet()) {
      cohorts.add(new VoterCohort(entry.getKey() + " voters", entry.getValue(), entry.getKey(), DEFAULT_TURNOUT));
    }
    return cohorts;
  }

  private static List<VoterCohort> readCohorts(List<CohortConfig> configs, String stateId) {
    double total = 0;
    for (CohortConfig cc : configs) {
      if (cc.name == null || cc.name.isBlank()) throw new ConfigurationFault(stateId, "Voter cohort without name");
      if (cc.share <= 0) throw new ConfigurationFault(stateId, "Cohort " + cc.name + " needs a positive share");
      if (cc.turnout < 0 || cc.turnout > 1) throw new ConfigurationFault(stateId, "Cohort " + cc.name + " turnout out of [0, 1]");
      total += cc.share;
    }
    List<VoterCohort> cohorts = new ArrayList<>();
    for (CohortConfig cc : configs) {
      cohorts.add(new VoterCohort(cc.name, cc.share / total, cc.lean, cc.turnout));
    }
    return cohorts;
  }

  /** District electorates vary the state's cohort shares a little and renormalize them. */
  private static List<VoterCohort> perturbCohorts(List<VoterCohort> cohorts, RandomStream stream) {
    double[] shares = new double[cohorts.size()];
    double total = 0;
    for (int i = 0; i < shares.length; i++) {
      double share = cohorts.get(i).share() + stream.uniform(-COHORT_SPREAD, COHORT_SPREAD);
      shares[i] = Math.max(MIN_COHORT_SHARE, Math.min(MAX_COHORT_SHARE, share));
      total += shares[i];
    }
    List<VoterCohort> out = new ArrayList<>();
    for (int i = 0; i < shares.length; i++) {
      VoterCohort c = cohorts.get(i);
      out.add(new VoterCohort(c.name(), shares[i] / total, c.lean(), c.turnout()));
    }
    return out;
  }

  private static Map<String, Double> normalize(Map<String, Double> raw, String stateId) {
    double total = 0;
    for (var entry : raw.entrySet()) {
      if (entry.getValue() == null || entry.getValue() < 0) {
        throw new ConfigurationFault(stateId, "Negative lean for " + entry.getKey());
      }
      total += entry.getValue();
    }
    if (total <= 0) throw new ConfigurationFault(stateId, "Party lean sums to zero");
    Map<String, Double> lean = new TreeMap<>();
    for (var entry : raw.entrySet()) {
      lean.put(entry.getKey(), entry.getValue() / total);
    }
    return lean;
  }

  private static Map<String, Double> perturb(Map<String, Double> lean, RandomStream stream) {
    Map<String, Double> raw = new TreeMap<>();
    for (var entry : lean.entrySet()) {
      raw.put(entry.getKey(), Math.max(MIN_LEAN, entry.getValue() + stream.uniform(-DISTRICT_SPREAD, DISTRICT_SPREAD)));
    }
    return normalize(raw, null);
  }

  public static class ScenarioConfig {
    public String president;
    public NationalConfig national;
    public List<PartyConfig> parties;
    public List<StateConfig> states;
    public Map<String, Map<String, Double>> opinion;
    public int legislatureSize = 100;
    public double stateTaxRate = 0.06;
    public double gdpPerCapita = 0.00007; // billions per resident
    public double spendingRatio = 1.02;
  }

  public static class NationalConfig {
    public double federalRevenue = 4500;
    public double federalSpending = 5200;
    public double federalTaxRate = 0.18;
    public double growth = 0.02;
    public double unemployment = 5.5;
    public double inflation = 2.5;
    public double presidentApproval = 50;
    public double congressApproval = 40;
    public String courtLean;
  }

  public static class PartyConfig {
    public String id;
    public String name;
    public Map<String, Double> platform;
    public double treasury;
    public double approval = 50;
  }

  public static class StateConfig {
    public String id;
    public String name;
    public long population;
    public int districts;
    public Map<String, Double> lean;
    public int legislatureSize;
    public double taxRate;
    public List<CohortConfig> cohorts;
  }

  /** A {@code lean} of null marks unaligned voters. */
  public static class CohortConfig {
    public String name;
    public double share;
    public String lean;
    public double turnout = DEFAULT_TURNOUT;
  }
}
