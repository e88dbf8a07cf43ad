package ussim.domain;

public enum ElectionStatus {
  PENDING,
  IN_PROGRESS,
  RESOLVED
}
