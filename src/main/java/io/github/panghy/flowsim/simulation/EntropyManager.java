package io.github.panghy.flowsim.simulation;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derives independent, reproducible random streams from one master seed.
 *
 * <p>The seed of the stream for {@code (host, purpose)} is a pure function of the master
 * seed, the host id and the purpose string: FNV-1a over the purpose bytes, combined with
 * the host id and the master seed through the SplitMix64 finalizer. Streams are created
 * lazily and cached, so asking for the same key twice returns the same stream with its
 * draw count intact.</p>
 */
public class EntropyManager {

  private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
  private static final long FNV_PRIME = 0x100000001b3L;
  private static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

  private final long masterSeed;
  private final Map<StreamKey, EntropyStream> streams = new HashMap<>();

  private record StreamKey(HostId host, String purpose) {
  }

  /**
   * Creates a manager for the given master seed.
   *
   * @param masterSeed The seed of the run
   */
  public EntropyManager(long masterSeed) {
    this.masterSeed = masterSeed;
  }

  public long getMasterSeed() {
    return masterSeed;
  }

  /**
   * Gets the stream for a host and purpose, creating it on first use.
   *
   * @param host    The host owning the stream
   * @param purpose What the stream is used for, e.g. {@code "net.latency"}
   * @return The stream
   */
  public EntropyStream streamFor(HostId host, String purpose) {
    Objects.requireNonNull(host, "Host cannot be null");
    Objects.requireNonNull(purpose, "Purpose cannot be null");
    return streams.computeIfAbsent(new StreamKey(host, purpose),
        key -> new EntropyStream(host, purpose, deriveSeed(masterSeed, host, purpose)));
  }

  /**
   * Draws the next 64 random bits from a stream.
   *
   * @param stream The stream
   * @return The next value
   */
  public long nextLong(EntropyStream stream) {
    return stream.nextLong();
  }

  /**
   * Computes the seed of the stream for {@code (host, purpose)}.
   *
   * @param masterSeed The master seed
   * @param host       The host
   * @param purpose    The purpose
   * @return The derived seed
   */
  public static long deriveSeed(long masterSeed, HostId host, String purpose) {
    long hash = FNV_OFFSET_BASIS;
    for (byte b : purpose.getBytes(StandardCharsets.UTF_8)) {
      hash ^= (b & 0xff);
      hash *= FNV_PRIME;
    }
    long keyed = mix64(hash + GOLDEN_GAMMA * (host.value() + 1L));
    return mix64(masterSeed ^ keyed);
  }

  static long mix64(long z) {
    z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
    z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
    return z ^ (z >>> 31);
  }
}
