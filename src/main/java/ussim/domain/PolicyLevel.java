package ussim.domain;

public enum PolicyLevel {
  FEDERAL,
  STATE
}
