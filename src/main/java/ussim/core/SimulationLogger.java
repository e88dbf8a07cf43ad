package ussim.core;

public final class SimulationLogger {
  private static volatile boolean quiet = Boolean.getBoolean("ussim.quiet");

  private SimulationLogger() {}

  public static void setQuiet(boolean value) {
    quiet = value;
  }

  public static void log(String line) {
    if (quiet || line == null || line.isBlank()) return;
    System.out.println(line);
  }
}
