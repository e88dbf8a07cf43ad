package ussim.config;

import ussim.core.ConfigurationFault;
import ussim.core.SimulationState;
import ussim.domain.Chamber;
import ussim.domain.Consequence;
import ussim.domain.District;
import ussim.domain.EventDefinition;
import ussim.domain.Issues;
import ussim.domain.PoliticalParty;
import ussim.domain.PolicyTemplate;
import ussim.domain.Regions;
import ussim.domain.SenateSeat;
import ussim.domain.State;
import ussim.domain.VoterCohort;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on an initial world and its catalogs. Everything here runs before the
 * first turn; any violation is a {@link ConfigurationFault}.
 */
public final class ScenarioValidator {
  private ScenarioValidator() {}

  public static void validate(SimulationState state) {
    if (state.parties().isEmpty()) {
      throw new ConfigurationFault(null, "At least one party is required");
    }
    String president = state.nation().presidentParty();
    if (president == null || !state.parties().containsKey(president)) {
      throw new ConfigurationFault(president, "President's party is not a known party");
    }
    String court = state.nation().courtLean();
    if (court != null && !state.parties().containsKey(court)) {
      throw new ConfigurationFault(court, "Supreme Court leans to an unknown party");
    }
    for (PoliticalParty party : state.parties().values()) {
      for (var stance : party.platform().entrySet()) {
        if (stance.getValue() < -1.0 || stance.getValue() > 1.0) {
          throw new ConfigurationFault(party.id(), "Platform stance out of [-1, 1] on " + stance.getKey());
        }
      }
    }

    Set<String> seatIds = new HashSet<>();
    int districts = 0;
    int senateSeats = 0;
    for (State st : state.states().values()) {
      requireKnownParties(state, st.lean(), st.id());
      if (st.governorParty() == null || !state.parties().containsKey(st.governorParty())) {
        throw new ConfigurationFault(st.id(), "Unknown governor party " + st.governorParty());
      }
      requireKnownParties(state, st.legislature(), st.id());
      requireCohorts(state, st.cohorts(), st.id());
      int legislature = st.legislature().values().stream().mapToInt(Integer::intValue).sum();
      if (legislature != st.legislatureSize()) {
        throw new ConfigurationFault(st.id(), "Legislature seats " + legislature + " != size " + st.legislatureSize());
      }
      for (District district : st.districts()) {
        if (!seatIds.add(district.id())) {
          throw new ConfigurationFault(district.id(), "District defined twice");
        }
        if (!st.id().equals(district.stateId())) {
          throw new ConfigurationFault(district.id(), "District belongs to " + district.stateId() + ", listed under " + st.id());
        }
        requireParty(state, district.incumbent(), district.id());
        requireCohorts(state, district.cohorts(), district.id());
        districts++;
      }
      for (SenateSeat seat : st.senateSeats()) {
        if (!seatIds.add(seat.id())) {
          throw new ConfigurationFault(seat.id(), "Senate seat defined twice");
        }
        if (seat.seatClass() < 1 || seat.seatClass() > 3) {
          throw new ConfigurationFault(seat.id(), "Senate class must be 1..3");
        }
        requireParty(state, seat.incumbent(), seat.id());
        senateSeats++;
      }
    }
    if (districts != state.chamberSize(Chamber.HOUSE)) {
      throw new ConfigurationFault("HOUSE", districts + " districts for a chamber of " + state.chamberSize(Chamber.HOUSE));
    }
    if (senateSeats != state.chamberSize(Chamber.SENATE)) {
      throw new ConfigurationFault("SENATE", senateSeats + " seats for a chamber of " + state.chamberSize(Chamber.SENATE));
    }
  }

  /** Cross-references catalogs against the world: issues, regions and consequence targets. */
  public static void validateCatalogs(SimulationState state, PolicyCatalog policies, EventCatalog events) {
    for (PolicyTemplate template : policies.all()) {
      if (!Issues.ALL.contains(template.issue())) {
        throw new ConfigurationFault(template.key(), "Unknown issue " + template.issue());
      }
      requireIssues(template.effect().opinion(), template.key());
    }
    for (EventDefinition event : events.all()) {
      requireIssues(event.effect().opinion(), event.key());
      for (String region : event.regions()) {
        requireRegion(state, region, event.key());
      }
      if (event.condition() != null && event.condition().region() != null) {
        requireRegion(state, event.condition().region(), event.key());
      }
      for (Consequence consequence : event.consequences()) {
        switch (consequence.type()) {
          case CHAIN_EVENT -> {
            if (events.get(consequence.target()) == null) {
              throw new ConfigurationFault(event.key(), "Chains to unknown event " + consequence.target());
            }
          }
          case POLICY_PROPOSAL -> {
            if (policies.get(consequence.target()) == null) {
              throw new ConfigurationFault(event.key(), "Proposes unknown policy " + consequence.target());
            }
          }
          case PARTY_APPROVAL -> { }
          default -> throw new IllegalStateException("Unhandled consequence " + consequence.type());
        }
      }
    }
  }

  private static void requireKnownParties(SimulationState state, Map<String, ?> byParty, String owner) {
    for (String partyId : byParty.keySet()) {
      if (!state.parties().containsKey(partyId)) {
        throw new ConfigurationFault(owner, "Unknown party " + partyId);
      }
    }
  }

  private static void requireCohorts(SimulationState state, List<VoterCohort> cohorts, String owner) {
    for (VoterCohort cohort : cohorts) {
      if (cohort.share() < 0.0 || cohort.share() > 1.0) {
        throw new ConfigurationFault(owner, "Cohort " + cohort.name() + " share out of [0, 1]");
      }
      if (cohort.turnout() < 0.0 || cohort.turnout() > 1.0) {
        throw new ConfigurationFault(owner, "Cohort " + cohort.name() + " turnout out of [0, 1]");
      }
      if (cohort.lean() != null && !state.parties().containsKey(cohort.lean())) {
        throw new ConfigurationFault(owner, "Cohort " + cohort.name() + " leans to unknown party " + cohort.lean());
      }
    }
  }

  private static void requireParty(SimulationState state, String partyId, String seatId) {
    if (partyId == null) {
      throw new ConfigurationFault(seatId, "Seat is vacant");
    }
    if (!state.parties().containsKey(partyId)) {
      throw new ConfigurationFault(seatId, "Seat held by unknown party " + partyId);
    }
  }

  private static void requireIssues(Map<String, Double> opinion, String owner) {
    for (String issue : opinion.keySet()) {
      if (!Issues.ALL.contains(issue)) {
        throw new ConfigurationFault(owner, "Unknown issue " + issue);
      }
    }
  }

  private static void requireRegion(SimulationState state, String region, String owner) {
    if (!Regions.NATIONAL.equals(region) && !state.states().containsKey(region)) {
      throw new ConfigurationFault(owner, "Unknown region " + region);
    }
  }
}
