package ussim.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public class SimulationConfig {
  public static final String DEFAULT_EVENTS_PATH = "classpath:ussim/events.json";
  public static final String DEFAULT_POLICIES_PATH = "classpath:ussim/policies.json";
  public static final String DEFAULT_SCENARIO_PATH = "classpath:ussim/default-scenario.json";

  private final long seed;
  private final int startYear;
  private final int startMonth;

  // Opinion
  private final double opinionDecayRate;
  private final double opinionMaxDelta;

  // Legislature
  private final double voteMajority;
  private final double voteSupermajority;
  private final double partyDiscipline;

  // Elections
  private final double incumbencyBonus;
  private final double campaignEffect;
  private final double electionOpinionWeight;
  private final double electionNoise;

  // Events and AI
  private final double randomEventChance;
  private final int maxRandomEventsPerTurn;
  private final double aiNoise;

  private final String eventsPath;
  private final String policiesPath;
  private final String scenarioPath;

  public SimulationConfig(long seed, int startYear, int startMonth, double opinionDecayRate, double opinionMaxDelta,
                          double voteMajority, double voteSupermajority, double partyDiscipline,
                          double incumbencyBonus, double campaignEffect, double electionOpinionWeight,
                          double electionNoise, double randomEventChance, int maxRandomEventsPerTurn,
                          double aiNoise, String eventsPath, String policiesPath, String scenarioPath) {
    if (startMonth < 1 || startMonth > 12) throw new IllegalArgumentException("start month must be in 1..12");
    if (opinionDecayRate < 0 || opinionDecayRate > 1) throw new IllegalArgumentException("opinion decay must be in [0, 1]");
    if (opinionMaxDelta <= 0) throw new IllegalArgumentException("opinion max delta must be positive");
    if (voteMajority <= 0 || voteMajority >= 1) throw new IllegalArgumentException("vote majority must be in (0, 1)");
    if (voteSupermajority < voteMajority || voteSupermajority >= 1) {
      throw new IllegalArgumentException("supermajority must be in [majority, 1)");
    }
    if (maxRandomEventsPerTurn < 0) throw new IllegalArgumentException("max random events must be >= 0");
    this.seed = seed;
    this.startYear = startYear;
    this.startMonth = startMonth;
    this.opinionDecayRate = opinionDecayRate;
    this.opinionMaxDelta = opinionMaxDelta;
    this.voteMajority = voteMajority;
    this.voteSupermajority = voteSupermajority;
    this.partyDiscipline = partyDiscipline;
    this.incumbencyBonus = incumbencyBonus;
    this.campaignEffect = campaignEffect;
    this.electionOpinionWeight = electionOpinionWeight;
    this.electionNoise = electionNoise;
    this.randomEventChance = randomEventChance;
    this.maxRandomEventsPerTurn = maxRandomEventsPerTurn;
    this.aiNoise = aiNoise;
    this.eventsPath = eventsPath;
    this.policiesPath = policiesPath;
    this.scenarioPath = scenarioPath;
  }

  public long seed() { return seed; }
  public int startYear() { return startYear; }
  public int startMonth() { return startMonth; }
  public double opinionDecayRate() { return opinionDecayRate; }
  public double opinionMaxDelta() { return opinionMaxDelta; }
  public double voteMajority() { return voteMajority; }
  public double voteSupermajority() { return voteSupermajority; }
  public double partyDiscipline() { return partyDiscipline; }
  public double incumbencyBonus() { return incumbencyBonus; }
  public double campaignEffect() { return campaignEffect; }
  public double electionOpinionWeight() { return electionOpinionWeight; }
  public double electionNoise() { return electionNoise; }
  public double randomEventChance() { return randomEventChance; }
  public int maxRandomEventsPerTurn() { return maxRandomEventsPerTurn; }
  public double aiNoise() { return aiNoise; }
  public String eventsPath() { return eventsPath; }
  public String policiesPath() { return policiesPath; }
  public String scenarioPath() { return scenarioPath; }

  public static SimulationConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .seed(seed)
        .start(startYear, startMonth)
        .opinionDecayRate(opinionDecayRate)
        .opinionMaxDelta(opinionMaxDelta)
        .voteMajority(voteMajority)
        .voteSupermajority(voteSupermajority)
        .partyDiscipline(partyDiscipline)
        .incumbencyBonus(incumbencyBonus)
        .campaignEffect(campaignEffect)
        .electionOpinionWeight(electionOpinionWeight)
        .electionNoise(electionNoise)
        .randomEventChance(randomEventChance)
        .maxRandomEventsPerTurn(maxRandomEventsPerTurn)
        .aiNoise(aiNoise)
        .eventsPath(eventsPath)
        .policiesPath(policiesPath)
        .scenarioPath(scenarioPath);
  }

  public static SimulationConfig load() throws IOException {
    return load(Path.of("config.properties"));
  }

  public static SimulationConfig load(Path path) throws IOException {
    Properties props = new Properties();
    if (Files.exists(path)) {
      try (InputStream in = Files.newInputStream(path)) {
        props.load(in);
      }
    }
    SimulationConfig d = defaults();
    return builder()
        .seed(getLongValue(props, "seed", "USSIM_SEED", d.seed))
        .start(getIntValue(props, "start.year", "USSIM_START_YEAR", d.startYear),
            getIntValue(props, "start.month", "USSIM_START_MONTH", d.startMonth))
        .opinionDecayRate(getDoubleValue(props, "opinion.decay_rate", "USSIM_OPINION_DECAY_RATE", d.opinionDecayRate))
        .opinionMaxDelta(getDoubleValue(props, "opinion.max_delta", "USSIM_OPINION_MAX_DELTA", d.opinionMaxDelta))
        .voteMajority(getDoubleValue(props, "vote.majority", "USSIM_VOTE_MAJORITY", d.voteMajority))
        .voteSupermajority(getDoubleValue(props, "vote.supermajority", "USSIM_VOTE_SUPERMAJORITY", d.voteSupermajority))
        .partyDiscipline(getDoubleValue(props, "vote.party_discipline", "USSIM_VOTE_PARTY_DISCIPLINE", d.partyDiscipline))
        .incumbencyBonus(getDoubleValue(props, "election.incumbency_bonus", "USSIM_INCUMBENCY_BONUS", d.incumbencyBonus))
        .campaignEffect(getDoubleValue(props, "election.campaign_effect", "USSIM_CAMPAIGN_EFFECT", d.campaignEffect))
        .electionOpinionWeight(getDoubleValue(props, "election.opinion_weight", "USSIM_ELECTION_OPINION_WEIGHT",
            d.electionOpinionWeight))
        .electionNoise(getDoubleValue(props, "election.noise", "USSIM_ELECTION_NOISE", d.electionNoise))
        .randomEventChance(getDoubleValue(props, "events.random_chance", "USSIM_RANDOM_EVENT_CHANCE", d.randomEventChance))
        .maxRandomEventsPerTurn(getIntValue(props, "events.max_random_per_turn", "USSIM_MAX_RANDOM_EVENTS",
            d.maxRandomEventsPerTurn))
        .aiNoise(getDoubleValue(props, "ai.noise", "USSIM_AI_NOISE", d.aiNoise))
        .eventsPath(getValue(props, "events.path", "USSIM_EVENTS_PATH", d.eventsPath))
        .policiesPath(getValue(props, "policies.path", "USSIM_POLICIES_PATH", d.policiesPath))
        .scenarioPath(getValue(props, "scenario.path", "USSIM_SCENARIO_PATH", d.scenarioPath))
        .build();
  }

  private static String getValue(Properties props, String key, String envKey, String defaultValue) {
    String env = System.getenv(envKey);
    if (env != null && !env.isBlank()) return env;
    String value = props.getProperty(key);
    if (value != null && !value.isBlank()) return value;
    return defaultValue;
  }

  private static int getIntValue(Properties props, String key, String envKey, int defaultValue) {
    String raw = getValue(props, key, envKey, null);
    if (raw == null) return defaultValue;
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
    }
  }

  private static long getLongValue(Properties props, String key, String envKey, long defaultValue) {
    String raw = getValue(props, key, envKey, null);
    if (raw == null) return defaultValue;
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
    }
  }

  private static double getDoubleValue(Properties props, String key, String envKey, double defaultValue) {
    String raw = getValue(props, key, envKey, null);
    if (raw == null) return defaultValue;
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, e);
    }
  }

  public static final class Builder {
    private long seed = 0L;
    private int startYear = 2025;
    private int startMonth = 1;
    private double opinionDecayRate = 0.05;
    private double opinionMaxDelta = 0.5;
    private double voteMajority = 0.5;
    private double voteSupermajority = 2.0 / 3.0;
    private double partyDiscipline = 0.35;
    private double incumbencyBonus = 0.02;
    private double campaignEffect = 0.04;
    private double electionOpinionWeight = 0.08;
    private double electionNoise = 0.03;
    private double randomEventChance = 0.35;
    private int maxRandomEventsPerTurn = 1;
    private double aiNoise = 0.01;
    private String eventsPath = DEFAULT_EVENTS_PATH;
    private String policiesPath = DEFAULT_POLICIES_PATH;
    private String scenarioPath = DEFAULT_SCENARIO_PATH;

    private Builder() {}

    public Builder seed(long value) { this.seed = value; return this; }
    public Builder start(int year, int month) { this.startYear = year; this.startMonth = month; return this; }
    public Builder opinionDecayRate(double value) { this.opinionDecayRate = value; return this; }
    public Builder opinionMaxDelta(double value) { this.opinionMaxDelta = value; return this; }
    public Builder voteMajority(double value) { this.voteMajority = value; return this; }
    public Builder voteSupermajority(double value) { this.voteSupermajority = value; return this; }
    public Builder partyDiscipline(double value) { this.partyDiscipline = value; return this; }
    public Builder incumbencyBonus(double value) { this.incumbencyBonus = value; return this; }
    public Builder campaignEffect(double value) { this.campaignEffect = value; return this; }
    public Builder electionOpinionWeight(double value) { this.electionOpinionWeight = value; return this; }
    public Builder electionNoise(double value) { this.electionNoise = value; return this; }
    public Builder randomEventChance(double value) { this.randomEventChance = value; return this; }
    public Builder maxRandomEventsPerTurn(int value) { this.maxRandomEventsPerTurn = value; return this; }
    public Builder aiNoise(double value) { this.aiNoise = value; return this; }
    public Builder eventsPath(String value) { this.eventsPath = value; return this; }
    public Builder policiesPath(String value) { this.policiesPath = value; return this; }
    public Builder scenarioPath(String value) { this.scenarioPath = value; return this; }

    public SimulationConfig build() {
      return new SimulationConfig(seed, startYear, startMonth, opinionDecayRate, opinionMaxDelta, voteMajority,
          voteSupermajority, partyDiscipline, incumbencyBonus, campaignEffect, electionOpinionWeight, electionNoise,
          randomEventChance, maxRandomEventsPerTurn, aiNoise, eventsPath, policiesPath, scenarioPath);
    }
  }
}
