package ussim.persistence;

/**
 * A snapshot document could not be loaded: malformed JSON, a missing required field, an
 * unknown enum value or a world that violates its invariants. The engine state is untouched.
 */
public class SnapshotLoadException extends Exception {
  public SnapshotLoadException(String message) {
    super(message);
  }

  public SnapshotLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
