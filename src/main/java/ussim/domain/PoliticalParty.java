package ussim.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

public class PoliticalParty {
  private final String id;
  private final String name;
  private final Map<String, Double> platform; // issue -> stance in [-1, 1]
  private double treasury;
  private double nationalApproval; // 0..100
  private final Map<Chamber, Integer> seats = new EnumMap<>(Chamber.class);

  public PoliticalParty(String id, String name, Map<String, Double> platform, double treasury, double nationalApproval) {
    this.id = id;
    this.name = name;
    this.platform = Collections.unmodifiableMap(new TreeMap<>(platform));
    this.treasury = treasury;
    this.nationalApproval = clampApproval(nationalApproval);
    for (Chamber chamber : Chamber.values()) {
      seats.put(chamber, 0);
    }
  }

  public String id() { return id; }
  public String name() { return name; }
  public Map<String, Double> platform() { return platform; }

  public double stanceOn(String issue) {
    return platform.getOrDefault(issue, 0.0);
  }

  public double treasury() { return treasury; }
  public void setTreasury(double treasury) { this.treasury = treasury; }

  public double nationalApproval() { return nationalApproval; }

  public void adjustApproval(double delta) {
    this.nationalApproval = clampApproval(nationalApproval + delta);
  }

  public void setNationalApproval(double value) {
    this.nationalApproval = clampApproval(value);
  }

  public int seats(Chamber chamber) { return seats.get(chamber); }
  public void setSeats(Chamber chamber, int count) { seats.put(chamber, count); }

  private static double clampApproval(double value) {
    return Math.max(0.0, Math.min(100.0, value));
  }
}
