package ussim.domain;

public enum PolicyStatus {
  PROPOSED,
  VOTING,
  ENACTED,
  REJECTED;

  public boolean isTerminal() {
    return this == ENACTED || this == REJECTED;
  }
}
