package ussim.domain;

public class SenateSeat {
  private final String id;
  private final String stateId;
  private final int seatClass; // 1..3
  private String incumbent;

  public SenateSeat(String id, String stateId, int seatClass, String incumbent) {
    this.id = id;
    this.stateId = stateId;
    this.seatClass = seatClass;
    this.incumbent = incumbent;
  }

  public String id() { return id; }
  public String stateId() { return stateId; }
  public int seatClass() { return seatClass; }
  public String incumbent() { return incumbent; }
  public void setIncumbent(String incumbent) { this.incumbent = incumbent; }
}
