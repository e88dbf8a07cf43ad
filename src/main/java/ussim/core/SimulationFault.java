package ussim.core;

/**
 * An internal invariant would be violated mid-turn. The turn that raised it is rolled back;
 * {@link #completedReport()} describes the turns of the same advance call that did complete.
 */
public class SimulationFault extends RuntimeException {
  private final int turn;
  private final String actorId;
  private final String entityId;
  private TurnReport completedReport = TurnReport.empty(0, 0);

  public SimulationFault(int turn, String actorId, String entityId, String message) {
    this(turn, actorId, entityId, message, null);
  }

  public SimulationFault(int turn, String actorId, String entityId, String message, Throwable cause) {
    super(describe(turn, actorId, entityId, message), cause);
    this.turn = turn;
    this.actorId = actorId;
    this.entityId = entityId;
  }

  public int turn() { return turn; }
  public String actorId() { return actorId; }
  public String entityId() { return entityId; }
  public TurnReport completedReport() { return completedReport; }

  void attachCompletedReport(TurnReport report) {
    if (report != null) this.completedReport = report;
  }

  private static String describe(int turn, String actorId, String entityId, String message) {
    StringBuilder sb = new StringBuilder(message == null ? "Simulation fault" : message);
    sb.append(" [turn=").append(turn);
    if (actorId != null) sb.append(", actor=").append(actorId);
    if (entityId != null) sb.append(", entity=").append(entityId);
    return sb.append(']').toString();
  }
}
