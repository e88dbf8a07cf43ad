package ussim.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * House district. Created once per state at initialization; its incumbent and voter-share
 * snapshot are recomputed every House election.
 */
public class District {
  private final String id;
  private final String stateId;
  private final Map<String, Double> lean; // party id -> baseline share
  private String incumbent; // null when vacant
  private Map<String, Double> voterShares = Map.of();
  private List<VoterCohort> cohorts = List.of();

  public District(String id, String stateId, Map<String, Double> lean, String incumbent) {
    this.id = id;
    this.stateId = stateId;
    this.lean = Collections.unmodifiableMap(new TreeMap<>(lean));
    this.incumbent = incumbent;
  }

  public String id() { return id; }
  public String stateId() { return stateId; }
  public Map<String, Double> lean() { return lean; }

  public String incumbent() { return incumbent; }
  public void setIncumbent(String incumbent) { this.incumbent = incumbent; }

  public List<VoterCohort> cohorts() { return cohorts; }
  public void setCohorts(List<VoterCohort> cohorts) { this.cohorts = List.copyOf(cohorts); }

  public Map<String, Double> voterShares() { return voterShares; }

  public void setVoterShares(Map<String, Double> shares) {
    this.voterShares = Collections.unmodifiableMap(new TreeMap<>(shares));
  }
}
