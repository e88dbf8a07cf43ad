package ussim.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class Election {
  private final String id;
  private final ElectionKind kind;
  private final int year;
  private final int month;
  private final List<String> contestedSeats;
  private ElectionStatus status = ElectionStatus.PENDING;
  private final Map<String, String> winners = new TreeMap<>(); // seat id -> party id
  private final Map<String, Integer> seatTotals = new TreeMap<>(); // party id -> seats after resolution

  public Election(String id, ElectionKind kind, int year, int month, List<String> contestedSeats) {
    this.id = id;
    this.kind = kind;
    this.year = year;
    this.month = month;
    this.contestedSeats = List.copyOf(contestedSeats);
  }

  public String id() { return id; }
  public ElectionKind kind() { return kind; }
  public int year() { return year; }
  public int month() { return month; }
  public List<String> contestedSeats() { return contestedSeats; }
  public ElectionStatus status() { return status; }
  public Map<String, String> winners() { return Collections.unmodifiableMap(winners); }
  public Map<String, Integer> seatTotals() { return Collections.unmodifiableMap(seatTotals); }

  public void begin() {
    if (status != ElectionStatus.PENDING) {
      throw new IllegalStateException("Election " + id + " already " + status);
    }
    status = ElectionStatus.IN_PROGRESS;
  }

  public void recordWinner(String seatId, String partyId) {
    if (status != ElectionStatus.IN_PROGRESS) {
      throw new IllegalStateException("Election " + id + " is not in progress");
    }
    winners.put(seatId, partyId);
  }

  public void resolve(Map<String, Integer> totals) {
    if (status != ElectionStatus.IN_PROGRESS) {
      throw new IllegalStateException("Election " + id + " is not in progress");
    }
    seatTotals.putAll(totals);
    status = ElectionStatus.RESOLVED;
  }

  public static Election restore(String id, ElectionKind kind, int year, int month, List<String> seats,
                                 ElectionStatus status, Map<String, String> winners, Map<String, Integer> totals) {
    Election election = new Election(id, kind, year, month, seats);
    election.status = status;
    election.winners.putAll(winners);
    election.seatTotals.putAll(totals);
    return election;
  }

  @Override
  public String toString() {
    return kind + " election " + String.format("%04d-%02d", year, month) + " " + seatTotals;
  }
}
