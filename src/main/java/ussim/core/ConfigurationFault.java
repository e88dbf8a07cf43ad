package ussim.core;

/**
 * Invalid initial setup (seat counts that do not add up, overlapping districts, unknown
 * party references). Raised before any turn runs.
 */
public class ConfigurationFault extends RuntimeException {
  private final String entityId;

  public ConfigurationFault(String entityId, String message) {
    super(message + (entityId == null ? "" : " [entity=" + entityId + "]"));
    this.entityId = entityId;
  }

  public ConfigurationFault(String entityId, String message, Throwable cause) {
    super(message + (entityId == null ? "" : " [entity=" + entityId + "]"), cause);
    this.entityId = entityId;
  }

  public String entityId() { return entityId; }
}
