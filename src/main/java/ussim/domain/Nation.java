package ussim.domain;

/**
 * National government and macro economy. Rates follow the conventions of {@link EffectVector}.
 */
public class Nation {
  public static final double MIN_GROWTH = -0.05;
  public static final double MAX_GROWTH = 0.06;
  public static final double MIN_UNEMPLOYMENT = 2.5;
  public static final double MAX_UNEMPLOYMENT = 20.0;
  public static final double MAX_INFLATION = 10.0;
  public static final double PRESIDENT_APPROVAL_BASELINE = 50.0;
  public static final double CONGRESS_APPROVAL_BASELINE = 40.0;

  private String presidentParty;
  private double federalRevenue;
  private double federalSpending;
  private double federalTaxRate;
  private double growth;
  private double unemployment;
  private double inflation;
  private double presidentApproval = PRESIDENT_APPROVAL_BASELINE;
  private double congressApproval = CONGRESS_APPROVAL_BASELINE;
  private String courtLean; // party the Supreme Court majority leans to, null when balanced

  public Nation(String presidentParty, double federalRevenue, double federalSpending, double federalTaxRate,
                double growth, double unemployment, double inflation) {
    this.presidentParty = presidentParty;
    this.federalRevenue = federalRevenue;
    this.federalSpending = federalSpending;
    this.federalTaxRate = federalTaxRate;
    this.growth = growth;
    this.unemployment = unemployment;
    this.inflation = inflation;
  }

  public String presidentParty() { return presidentParty; }
  public void setPresidentParty(String presidentParty) { this.presidentParty = presidentParty; }

  public double presidentApproval() { return presidentApproval; }
  public void setPresidentApproval(double approval) { this.presidentApproval = clampApproval(approval); }
  public double congressApproval() { return congressApproval; }
  public void setCongressApproval(double approval) { this.congressApproval = clampApproval(approval); }

  public String courtLean() { return courtLean; }
  public void setCourtLean(String courtLean) { this.courtLean = courtLean; }

  public double federalRevenue() { return federalRevenue; }
  public void setFederalRevenue(double federalRevenue) { this.federalRevenue = federalRevenue; }
  public double federalSpending() { return federalSpending; }
  public void setFederalSpending(double federalSpending) { this.federalSpending = federalSpending; }
  public double federalTaxRate() { return federalTaxRate; }

  public double federalDeficit() {
    return federalSpending - federalRevenue;
  }

  public double growth() { return growth; }
  public double unemployment() { return unemployment; }
  public double inflation() { return inflation; }

  public void setGrowth(double growth) {
    this.growth = Math.max(MIN_GROWTH, Math.min(MAX_GROWTH, growth));
  }

  public void setUnemployment(double unemployment) {
    this.unemployment = Math.max(MIN_UNEMPLOYMENT, Math.min(MAX_UNEMPLOYMENT, unemployment));
  }

  public void setInflation(double inflation) {
    this.inflation = Math.max(0.0, Math.min(MAX_INFLATION, inflation));
  }

  /** Applies the economy part of an effect at national level. Budget deltas land on federal spending. */
  public void applyEconomy(EffectVector effect) {
    setGrowth(growth + effect.growth());
    setUnemployment(unemployment + effect.unemployment());
    setInflation(inflation + effect.inflation());
    federalSpending += effect.budget();
  }

  /** Office approvals are percentages in [0, 100]. */
  public static double clampApproval(double approval) {
    return Math.max(0.0, Math.min(100.0, approval));
  }
}
