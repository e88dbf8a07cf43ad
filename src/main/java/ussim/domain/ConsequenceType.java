package ussim.domain;

public enum ConsequenceType {
  CHAIN_EVENT,
  POLICY_PROPOSAL,
  PARTY_APPROVAL
}
