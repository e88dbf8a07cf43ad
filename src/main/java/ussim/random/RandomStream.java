package ussim.random;

import java.util.SplittableRandom;

/**
 * One deterministic stream of draws. Obtain via {@link RandomStreams#open(String, int)}.
 */
public final class RandomStream {
  private final String key;
  private final SplittableRandom random;

  RandomStream(String key, long seed) {
    this.key = key;
    this.random = new SplittableRandom(seed);
  }

  public String key() { return key; }

  public double nextDouble() {
    return random.nextDouble();
  }

  public double uniform(double min, double max) {
    if (max <= min) return min;
    return min + (max - min) * random.nextDouble();
  }

  public int nextInt(int bound) {
    return random.nextInt(bound);
  }

  public boolean chance(double probability) {
    if (probability <= 0) return false;
    if (probability >= 1) return true;
    return random.nextDouble() < probability;
  }
}
