package ussim.elections;

import org.junit.jupiter.api.Test;
import ussim.domain.PoliticalParty;
import ussim.domain.VoterCohort;
import ussim.opinion.PublicOpinionTracker;
import ussim.random.RandomStreams;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VoterModelTest {
  private final PublicOpinionTracker opinion = new PublicOpinionTracker(0.05, 0.5);

  @Test
  void exactTieWithoutIncumbentGoesToFirstPartyId() {
    VoterModel model = new VoterModel(0.02, 0.04, 0.08, 0.0);
    List<PoliticalParty> candidates = List.of(
        new PoliticalParty("B", "Party B", Map.of(), 0, 50),
        new PoliticalParty("A", "Party A", Map.of(), 0, 50));
    VoterModel.Race race = new VoterModel.Race("X-01", "X", Map.of("A", 0.5, "B", 0.5), null, Map.of());

    Map<String, Double> shares = model.voteShares(race, candidates, opinion, new RandomStreams(1).open("t", 1));

    assertEquals(shares.get("A"), shares.get("B"));
    assertEquals("A", VoterModel.pickWinner(shares, null));
  }

  @Test
  void exactTieGoesToIncumbentWhenTied() {
    assertEquals("B", VoterModel.pickWinner(Map.of("A", 0.5, "B", 0.5), "B"));
    assertEquals("A", VoterModel.pickWinner(Map.of("A", 0.4, "B", 0.4, "C", 0.2), "C"));
  }

  @Test
  void sharesAreNormalizedAndFloored() {
    VoterModel model = new VoterModel(0.02, 0.04, 0.08, 0.03);
    List<PoliticalParty> candidates = List.of(
        new PoliticalParty("A", "Party A", Map.of(), 0, 100),
        new PoliticalParty("B", "Party B", Map.of(), 0, 0));
    VoterModel.Race race = new VoterModel.Race("X-01", "X", Map.of("A", 1.0, "B", 0.0), "A", Map.of("A", 5.0));

    Map<String, Double> shares = model.voteShares(race, candidates, opinion, new RandomStreams(3).open("t", 1));

    assertEquals(1.0, shares.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-12);
    assertTrue(shares.get("B") > 0.0);
    assertEquals("A", VoterModel.pickWinner(shares, "A"));
  }

  @Test
  void opinionAlignedWithPlatformRaisesShare() {
    VoterModel model = new VoterModel(0.0, 0.0, 0.5, 0.0);
    List<PoliticalParty> candidates = List.of(
        new PoliticalParty("A", "Party A", Map.of("environment", 1.0), 0, 50),
        new PoliticalParty("B", "Party B", Map.of("environment", -1.0), 0, 50));
    opinion.apply(0.5, "X", "environment");
    VoterModel.Race race = new VoterModel.Race("X-01", "X", Map.of("A", 0.5, "B", 0.5), null, Map.of());

    Map<String, Double> shares = model.voteShares(race, candidates, opinion, new RandomStreams(1).open("t", 1));

    assertTrue(shares.get("A") > shares.get("B"));
  }

  @Test
  void cohortBaselineWeighsShareByTurnout() {
    Map<String, Double> lean = VoterModel.cohortLean(List.of(
        new VoterCohort("Urban", 0.5, "A", 0.8),
        new VoterCohort("Rural", 0.5, "B", 0.4)), Map.of());

    assertEquals(2.0 / 3.0, lean.get("A"), 1e-12);
    assertEquals(1.0 / 3.0, lean.get("B"), 1e-12);
  }

  @Test
  void unalignedCohortsDiluteAndEmptyElectorateFallsBack() {
    Map<String, Double> fallback = Map.of("A", 0.3, "B", 0.7);

    Map<String, Double> lean = VoterModel.cohortLean(List.of(
        new VoterCohort("A voters", 0.5, "A", 0.5),
        new VoterCohort("Unaligned", 0.5, null, 0.5)), fallback);

    assertEquals(Map.of("A", 0.5), lean);
    assertEquals(fallback, VoterModel.cohortLean(List.of(), fallback));
    assertEquals(fallback, VoterModel.cohortLean(List.of(new VoterCohort("Stay home", 1.0, "A", 0.0)), fallback));
  }

  @Test
  void approvalSignalMovesShares() {
    VoterModel model = new VoterModel(0.0, 0.0, 0.0, 0.0);
    List<PoliticalParty> candidates = List.of(
        new PoliticalParty("A", "Party A", Map.of(), 0, 50),
        new PoliticalParty("B", "Party B", Map.of(), 0, 50));
    VoterModel.Race race = new VoterModel.Race("X-01", "X", Map.of("A", 0.5, "B", 0.5), null, Map.of(),
        Map.of("B", 0.05));

    Map<String, Double> shares = model.voteShares(race, candidates, opinion, new RandomStreams(1).open("t", 1));

    assertEquals(0.55 / 1.05, shares.get("B"), 1e-12);
    assertEquals("B", VoterModel.pickWinner(shares, "A"));
  }

  @Test
  void largestRemainderPreservesSeatTotal() {
    Map<String, Integer> seats = VoterModel.allocateSeats(Map.of("A", 1.0 / 3, "B", 1.0 / 3, "C", 1.0 / 3), 100);

    assertEquals(100, seats.values().stream().mapToInt(Integer::intValue).sum());
    assertEquals(34, seats.get("A"));
    assertEquals(33, seats.get("B"));
    assertEquals(33, seats.get("C"));
  }
}
