package com.onthegomap.tilegen.stats;

import com.onthegomap.tilegen.util.Format;
import java.time.Duration;
import java.util.function.LongSupplier;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Tracks how far a tile generation run has come and estimates the time remaining.
 * <p>
 * Only the dispatcher control thread updates and renders an instance. Failed tiles count towards
 * {@link #completedCount()} since they are also terminal.
 */
@NotThreadSafe
public class RunProgress {

  static final int BAR_WIDTH = 40;
  private static final char FILLED = '█';
  private static final char EMPTY = '░';

  private final long totalCount;
  private final long startNanos;
  private final LongSupplier nanoTime;
  private long completedCount = 0;
  private long failedCount = 0;

  RunProgress(long totalCount, LongSupplier nanoTime) {
    if (totalCount < 0) {
      throw new IllegalArgumentException("totalCount must be >= 0, was " + totalCount);
    }
    this.totalCount = totalCount;
    this.nanoTime = nanoTime;
    this.startNanos = nanoTime.getAsLong();
  }

  /** Returns a tracker for {@code totalCount} tasks whose clock starts now. */
  public static RunProgress start(long totalCount) {
    return new RunProgress(totalCount, System::nanoTime);
  }

  public void recordCompleted() {
    increment();
  }

  public void recordFailed() {
    increment();
    failedCount++;
  }

  private void increment() {
    if (completedCount >= totalCount) {
      throw new IllegalStateException("More outcomes than tasks: " + totalCount);
    }
    completedCount++;
  }

  public long completedCount() {
    return completedCount;
  }

  public long failedCount() {
    return failedCount;
  }

  public long totalCount() {
    return totalCount;
  }

  public Duration elapsed() {
    return Duration.ofNanos(nanoTime.getAsLong() - startNanos);
  }

  /** Returns tiles finished per second so far. */
  public double throughput() {
    double seconds = elapsed().toNanos() / 1e9;
    return seconds <= 0 ? 0 : completedCount / seconds;
  }

  /** Returns the estimated seconds remaining, or 0 before any throughput has been measured. */
  public double etaSeconds() {
    double throughput = throughput();
    return throughput <= 0 ? 0 : (totalCount - completedCount) / throughput;
  }

  /** Returns the whole percent complete, 100 for an empty run. */
  public int percent() {
    return totalCount == 0 ? 100 : (int) (completedCount * 100 / totalCount);
  }

  /** Returns a fixed-width bar like {@code ████░░░░} with one filled cell per 2.5% complete. */
  public String bar() {
    int filled = totalCount == 0 ? BAR_WIDTH : (int) (completedCount * BAR_WIDTH / totalCount);
    return String.valueOf(FILLED).repeat(filled) + String.valueOf(EMPTY).repeat(BAR_WIDTH - filled);
  }

  /** Returns the progress line like {@code ████░░ 42% (7/17) 3.5 tiles/s elapsed 00:00:02 eta 00:00:03}. */
  public String render() {
    Format format = Format.defaultInstance();
    return "%s %3d%% (%d/%d) %s tiles/s elapsed %s eta %s".formatted(
      bar(),
      percent(),
      completedCount,
      totalCount,
      format.decimal(throughput()),
      Format.clock(elapsed()),
      Format.clock(etaSeconds())
    );
  }

  @Override
  public String toString() {
    return render();
  }
}
