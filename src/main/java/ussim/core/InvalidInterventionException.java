package ussim.core;

/**
 * A manual intervention was rejected. Nothing was mutated.
 */
public class InvalidInterventionException extends Exception {
  private final String actorId;
  private final String entityId;

  public InvalidInterventionException(String actorId, String entityId, String reason) {
    super(reason + " [actor=" + actorId + ", entity=" + entityId + "]");
    this.actorId = actorId;
    this.entityId = entityId;
  }

  public String actorId() { return actorId; }
  public String entityId() { return entityId; }
}
