package xcsp2cpo.util;

/** Wall-clock timer for a run and for the stages inside it. */
public final class Timing {
  private final long startedAt;
  private long lapStartedAt;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
    this.lapStartedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }

  /** Milliseconds since the previous lap, or since the start for the first one. */
  public long lapMillis() {
    long now = System.nanoTime();
    long lap = (now - lapStartedAt) / 1_000_000L;
    lapStartedAt = now;
    return lap;
  }
}
