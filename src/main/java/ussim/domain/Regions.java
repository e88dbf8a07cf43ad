package ussim.domain;

public final class Regions {
  /** Region id for nationwide opinion. State regions use the state id. */
  public static final String NATIONAL = "US";

  private Regions() {}
}
