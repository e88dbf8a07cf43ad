package ussim.random;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hash-derived random streams. A stream's seed depends only on the global seed, the stream key
 * (actor id or subsystem name), the turn and how many times that key was opened before, so
 * actors never share draws and iteration order over actors does not change any outcome.
 * The per-key counters are part of the persisted snapshot.
 */
public class RandomStreams {
  private final long seed;
  private final Map<String, Long> counters = new TreeMap<>();

  public RandomStreams(long seed) {
    this.seed = seed;
  }

  public RandomStreams(long seed, Map<String, Long> counters) {
    this.seed = seed;
    for (var entry : counters.entrySet()) {
      if (entry.getValue() == null || entry.getValue() < 0) {
        throw new IllegalArgumentException("Invalid stream counter for " + entry.getKey());
      }
      this.counters.put(entry.getKey(), entry.getValue());
    }
  }

  public long seed() { return seed; }

  public Map<String, Long> counters() {
    return Collections.unmodifiableMap(counters);
  }

  public long counter(String key) {
    return counters.getOrDefault(key, 0L);
  }

  public RandomStream open(String key, int turn) {
    long count = counters.getOrDefault(key, 0L);
    counters.put(key, count + 1);
    return new RandomStream(key, derive(seed, key, turn, count));
  }

  static long derive(long seed, String key, int turn, long count) {
    long h = mix(seed ^ 0x9E3779B97F4A7C15L);
    h = mix(h ^ fnv1a(key));
    h = mix(h ^ turn);
    return mix(h ^ count);
  }

  private static long fnv1a(String key) {
    long hash = 0xcbf29ce484222325L;
    for (byte b : key.getBytes(StandardCharsets.UTF_8)) {
      hash ^= (b & 0xff);
      hash *= 0x100000001b3L;
    }
    return hash;
  }

  // SplitMix64 finalizer.
  private static long mix(long z) {
    z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
    z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
    return z ^ (z >>> 31);
  }
}
