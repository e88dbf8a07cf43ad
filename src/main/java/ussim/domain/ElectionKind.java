package ussim.domain;

public enum ElectionKind {
  HOUSE,
  SENATE,
  STATE_LEGISLATURE,
  PRESIDENTIAL
}
