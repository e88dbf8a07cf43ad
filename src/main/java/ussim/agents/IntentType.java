package ussim.agents;

public enum IntentType {
  PROPOSE,
  CAMPAIGN,
  ADJUST_BUDGET,
  IDLE
}
