package com.onthegomap.tilegen.stats;

import com.onthegomap.tilegen.util.Format;
import java.time.Duration;
import java.util.Optional;

/**
 * A snapshot of the wall, CPU and GC time this JVM has consumed, used to measure how long a stage took.
 */
public record ProcessTime(Duration wall, Optional<Duration> cpu, Duration gc) {

  public static ProcessTime now() {
    return new ProcessTime(Duration.ofNanos(System.nanoTime()), ProcessInfo.getProcessCpuTime(),
      ProcessInfo.getGcTime());
  }

  /** Returns the time elapsed between {@code other} and {@code this}. */
  ProcessTime minus(ProcessTime other) {
    return new ProcessTime(
      wall.minus(other.wall),
      cpu.flatMap(thisCpu -> other.cpu.map(thisCpu::minus)),
      gc.minus(other.gc)
    );
  }

  /** Returns a summary like {@code 1m5s cpu:3m58s gc:2s avg:3.7}. */
  @Override
  public String toString() {
    Format format = Format.defaultInstance();
    StringBuilder result = new StringBuilder(format.duration(wall))
      .append(" cpu:")
      .append(cpu.map(format::duration).orElse("-"));
    if (gc.compareTo(Duration.ofSeconds(1)) > 0) {
      result.append(" gc:").append(format.duration(gc));
    }
    cpu.ifPresent(total -> result.append(" avg:").append(format.decimal(total.toNanos() / (double) Math.max(1,
      wall.toNanos()))));
    return result.toString();
  }
}
