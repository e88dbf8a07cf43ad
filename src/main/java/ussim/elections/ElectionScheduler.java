package ussim.elections;

import ussim.core.SimulationFault;
import ussim.core.SimulationLogger;
import ussim.core.SimulationState;
import ussim.core.TurnContext;
import ussim.domain.Chamber;
import ussim.domain.District;
import ussim.domain.Election;
import ussim.domain.ElectionKind;
import ussim.domain.Nation;
import ussim.domain.PoliticalParty;
import ussim.domain.SenateSeat;
import ussim.domain.State;
import ussim.random.RandomStream;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Determines which elections fall due in the processed month, runs them through the
 * {@link VoterModel}, installs the winners and recounts chamber seats. The party that wins a
 * state legislature also takes the governorship.
 */
public class ElectionScheduler {
  public static final int ELECTION_MONTH = 11;
  public static final int BASE_SENATE_YEAR = 2024;
  public static final String PRESIDENCY_SEAT = "PRESIDENT";
  static final double PRESIDENT_SIGNAL = 1.0 / 500.0;
  static final double OFFICE_SIGNAL = 1.0 / 1000.0;

  private final VoterModel voterModel;

  public ElectionScheduler(VoterModel voterModel) {
    this.voterModel = voterModel;
  }

  public static List<ElectionKind> dueKinds(int year, int month) {
    List<ElectionKind> due = new ArrayList<>();
    if (month != ELECTION_MONTH || year % 2 != 0) {
      return due;
    }
    due.add(ElectionKind.HOUSE);
    due.add(ElectionKind.SENATE);
    due.add(ElectionKind.STATE_LEGISLATURE);
    if (year % 4 == 0) {
      due.add(ElectionKind.PRESIDENTIAL);
    }
    return due;
  }

  /** Senate class (1..3) contested in the given even year; the classes rotate every two years. */
  public static int senateClassUp(int year) {
    return Math.floorMod(Math.floorDiv(year - BASE_SENATE_YEAR, 2), 3) + 1;
  }

  public List<Election> runDue(SimulationState state, TurnContext turn) {
    List<Election> held = new ArrayList<>();
    List<ElectionKind> due = dueKinds(turn.year(), turn.month());
    if (due.isEmpty()) {
      return held;
    }
    String houseControlBefore = state.chamberControl(Chamber.HOUSE);
    for (ElectionKind kind : due) {
      Election election = run(state, turn, kind);
      held.add(election);
      turn.reportElection(election);
    }
    for (State s : state.states().values()) {
      s.clearCampaignSpend();
    }
    nudgeApproval(state, houseControlBefore);
    return held;
  }

  private Election run(SimulationState state, TurnContext turn, ElectionKind kind) {
    String electionId = String.format("%04d-%02d-%s", turn.year(), turn.month(), kind.name());
    Collection<PoliticalParty> candidates = state.parties().values();
    if (candidates.isEmpty()) {
      throw new SimulationFault(turn.turn(), null, electionId, "No eligible candidates");
    }
    RandomStream stream = state.streams().open("election:" + kind.name(), turn.turn());
    Election election = new Election(electionId, kind, turn.year(), turn.month(), contestedSeats(state, kind, turn.year()));
    state.recordElection(election);
    election.begin();

    Map<String, Integer> totals;
    switch (kind) {
      case HOUSE -> {
        for (State s : state.states().values()) {
          Map<String, Double> signals = officeSignals(state, s, Chamber.HOUSE);
          for (District district : s.districts()) {
            VoterModel.Race race = new VoterModel.Race(district.id(), s.id(),
                VoterModel.cohortLean(district.cohorts(), district.lean()), district.incumbent(), s.campaignSpend(),
                signals);
            Map<String, Double> shares = voterModel.voteShares(race, candidates, state.opinion(), stream);
            String winner = VoterModel.pickWinner(shares, district.incumbent());
            district.setVoterShares(shares);
            district.setIncumbent(winner);
            election.recordWinner(district.id(), winner);
          }
        }
        totals = recount(state, Chamber.HOUSE, turn.turn(), electionId);
      }
      case SENATE -> {
        int seatClass = senateClassUp(turn.year());
        for (State s : state.states().values()) {
          Map<String, Double> signals = officeSignals(state, s, Chamber.SENATE);
          for (SenateSeat seat : s.senateSeats()) {
            if (seat.seatClass() != seatClass) continue;
            VoterModel.Race race = new VoterModel.Race(seat.id(), s.id(), VoterModel.cohortLean(s.cohorts(), s.lean()),
                seat.incumbent(), s.campaignSpend(), signals);
            Map<String, Double> shares = voterModel.voteShares(race, candidates, state.opinion(), stream);
            String winner = VoterModel.pickWinner(shares, seat.incumbent());
            seat.setIncumbent(winner);
            election.recordWinner(seat.id(), winner);
          }
        }
        totals = recount(state, Chamber.SENATE, turn.turn(), electionId);
      }
      case STATE_LEGISLATURE -> {
        Map<String, Integer> legislatureTotals = new TreeMap<>();
        for (State s : state.states().values()) {
          String majority = s.legislatureMajority();
          VoterModel.Race race = new VoterModel.Race(legislatureSeat(s.id()), s.id(),
              VoterModel.cohortLean(s.cohorts(), s.lean()), majority, s.campaignSpend(), officeSignals(state, s, null));
          Map<String, Double> shares = voterModel.voteShares(race, candidates, state.opinion(), stream);
          Map<String, Integer> seats = VoterModel.allocateSeats(shares, s.legislatureSize());
          int sum = seats.values().stream().mapToInt(Integer::intValue).sum();
          if (sum != s.legislatureSize()) {
            throw new SimulationFault(turn.turn(), null, s.id(),
                "Legislature seat sum " + sum + " != size " + s.legislatureSize());
          }
          s.setLegislature(seats);
          String newMajority = s.legislatureMajority();
          if (!newMajority.equals(s.governorParty())) {
            state.log("Governor of " + s.id() + " passes from " + s.governorParty() + " to " + newMajority);
            s.setGovernorParty(newMajority);
            s.setGovernorApproval(State.GOVERNOR_APPROVAL_BASELINE);
          }
          election.recordWinner(legislatureSeat(s.id()), newMajority);
          seats.forEach((party, count) -> legislatureTotals.merge(party, count, Integer::sum));
        }
        totals = legislatureTotals;
      }
      case PRESIDENTIAL -> {
        Map<String, Double> popular = new TreeMap<>();
        double totalPopulation = 0;
        String incumbent = state.nation().presidentParty();
        for (State s : state.states().values()) {
          VoterModel.Race race = new VoterModel.Race(s.id() + "-PRES", s.id(), VoterModel.cohortLean(s.cohorts(), s.lean()),
              incumbent, s.campaignSpend(), officeSignals(state, s, null));
          Map<String, Double> shares = voterModel.voteShares(race, candidates, state.opinion(), stream);
          for (var entry : shares.entrySet()) {
            popular.merge(entry.getKey(), entry.getValue() * s.population(), Double::sum);
          }
          totalPopulation += s.population();
        }
        if (totalPopulation <= 0) {
          throw new SimulationFault(turn.turn(), null, electionId, "No voting population");
        }
        String winner = VoterModel.pickWinner(popular, incumbent);
        if (!winner.equals(incumbent)) {
          state.nation().setPresidentApproval(Nation.PRESIDENT_APPROVAL_BASELINE);
        }
        state.nation().setPresidentParty(winner);
        election.recordWinner(PRESIDENCY_SEAT, winner);
        totals = new TreeMap<>(Map.of(winner, 1));
      }
      default -> throw new IllegalStateException("Unhandled election kind " + kind);
    }

    election.resolve(totals);
    String line = kind + " election resolved: " + totals;
    state.log(line);
    SimulationLogger.log("[Election] " + String.format("%04d-%02d ", turn.year(), turn.month()) + line);
    return election;
  }

  private static List<String> contestedSeats(SimulationState state, ElectionKind kind, int year) {
    List<String> seats = new ArrayList<>();
    for (State s : state.states().values()) {
      switch (kind) {
        case HOUSE -> s.districts().forEach(d -> seats.add(d.id()));
        case SENATE -> {
          int seatClass = senateClassUp(year);
          for (SenateSeat seat : s.senateSeats()) {
            if (seat.seatClass() == seatClass) seats.add(seat.id());
          }
        }
        case STATE_LEGISLATURE -> seats.add(legislatureSeat(s.id()));
        case PRESIDENTIAL -> { }
        default -> throw new IllegalStateException("Unhandled election kind " + kind);
      }
    }
    if (kind == ElectionKind.PRESIDENTIAL) {
      seats.add(PRESIDENCY_SEAT);
    }
    return seats;
  }

  /**
   * Score shifts from office approvals: the president's party gains or loses with presidential
   * approval, the governor's and the legislature majority's with theirs, and for congressional
   * races the party controlling the chamber with congressional approval.
   */
  static Map<String, Double> officeSignals(SimulationState state, State s, Chamber chamber) {
    Map<String, Double> signals = new TreeMap<>();
    Nation nation = state.nation();
    if (nation.presidentParty() != null) {
      signals.merge(nation.presidentParty(),
          (nation.presidentApproval() - Nation.PRESIDENT_APPROVAL_BASELINE) * PRESIDENT_SIGNAL, Double::sum);
    }
    if (chamber != null && state.chamberControl(chamber) != null) {
      signals.merge(state.chamberControl(chamber),
          (nation.congressApproval() - Nation.CONGRESS_APPROVAL_BASELINE) * OFFICE_SIGNAL, Double::sum);
    }
    if (s.governorParty() != null) {
      signals.merge(s.governorParty(),
          (s.governorApproval() - State.GOVERNOR_APPROVAL_BASELINE) * OFFICE_SIGNAL, Double::sum);
    }
    String majority = s.legislatureMajority();
    if (majority != null) {
      signals.merge(majority,
          (s.legislatureApproval() - State.LEGISLATURE_APPROVAL_BASELINE) * OFFICE_SIGNAL, Double::sum);
    }
    return signals;
  }

  static String legislatureSeat(String stateId) {
    return stateId + "-LEG";
  }

  /**
   * Recomputes every party's seat count in the chamber from the seat incumbents. A vacancy,
   * an unknown incumbent or a sum different from the chamber size is a fault.
   */
  public static Map<String, Integer> recount(SimulationState state, Chamber chamber, int turn, String entityId) {
    Map<String, Integer> totals = new TreeMap<>();
    for (String partyId : state.parties().keySet()) {
      totals.put(partyId, 0);
    }
    int seatCount = 0;
    for (State s : state.states().values()) {
      List<String> incumbents = new ArrayList<>();
      if (chamber == Chamber.HOUSE) {
        s.districts().forEach(d -> incumbents.add(d.incumbent()));
      } else {
        s.senateSeats().forEach(seat -> incumbents.add(seat.incumbent()));
      }
      for (String incumbent : incumbents) {
        seatCount++;
        if (incumbent == null) {
          throw new SimulationFault(turn, null, entityId, "Vacant " + chamber + " seat in " + s.id());
        }
        if (!totals.containsKey(incumbent)) {
          throw new SimulationFault(turn, null, entityId, "Unknown party " + incumbent + " holds a seat in " + s.id());
        }
        totals.merge(incumbent, 1, Integer::sum);
      }
    }
    int size = state.chamberSize(chamber);
    if (seatCount != size) {
      throw new SimulationFault(turn, null, entityId, chamber + " seat sum " + seatCount + " != chamber size " + size);
    }
    for (var entry : totals.entrySet()) {
      state.party(entry.getKey()).setSeats(chamber, entry.getValue());
    }
    return totals;
  }

  private static void nudgeApproval(SimulationState state, String houseControlBefore) {
    String president = state.nation().presidentParty();
    String houseControlAfter = state.chamberControl(Chamber.HOUSE);
    if (president == null || houseControlAfter == null || houseControlAfter.equals(houseControlBefore)) {
      return;
    }
    if (!state.parties().containsKey(president)) {
      return;
    }
    boolean friendly = houseControlAfter.equals(president);
    state.party(president).adjustApproval(friendly ? 1.0 : -1.0);
    Nation nation = state.nation();
    nation.setPresidentApproval(nation.presidentApproval() + (friendly ? 1.0 : -1.0));
    nation.setCongressApproval(nation.congressApproval() + (friendly ? 0.5 : -0.5));
  }
}
