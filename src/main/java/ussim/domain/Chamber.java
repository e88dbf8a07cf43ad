package ussim.domain;

public enum Chamber {
  HOUSE,
  SENATE
}
