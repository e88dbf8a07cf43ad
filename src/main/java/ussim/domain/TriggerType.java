package ussim.domain;

public enum TriggerType {
  RANDOM,
  CONDITIONAL,
  SCHEDULED,
  MANUAL_ONLY
}
