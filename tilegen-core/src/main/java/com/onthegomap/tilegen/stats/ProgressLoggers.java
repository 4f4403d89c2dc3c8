package com.onthegomap.tilegen.stats;

import com.google.common.base.Strings;
import com.onthegomap.tilegen.util.Format;
import com.onthegomap.tilegen.worker.Worker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.DoubleFunction;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the periodic progress line for a running stage out of named segments like
 * {@code tiles: [ 1.2k  40% 310/s ]}, then logs it on demand.
 */
public class ProgressLoggers {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressLoggers.class);
  private static final String RESET = "\u001B[0m";
  private static final String RED = "\u001B[31m";
  private static final String GREEN = "\u001B[32m";
  private static final String YELLOW = "\u001B[33m";
  private static final String BLUE = "\u001B[34m";

  private final List<Supplier<String>> segments = new ArrayList<>();
  private final Format format;

  private ProgressLoggers(Format format) {
    this.format = format;
  }

  public static ProgressLoggers create() {
    return new ProgressLoggers(Format.defaultInstance());
  }

  private static String colored(String code, String text) {
    return code + text + RESET;
  }

  private ProgressLoggers addNamed(String name, Supplier<String> value) {
    segments.add(() -> " " + name + ": " + value.get());
    return this;
  }

  /**
   * Adds {@code name: [ count percent rate/s ]} where percent is {@code count / total}, or leaves percent out when
   * {@code total} is 0. Colored green while the count is rising if {@code color} is set.
   */
  public ProgressLoggers addRatePercentCounter(String name, long total, LongSupplier count, boolean color) {
    Rate rate = new Rate(count.getAsLong());
    return addNamed(name, () -> {
      long value = count.getAsLong();
      double perSecond = rate.update(value);
      StringBuilder text = new StringBuilder("[ ").append(format.numeric(value, true));
      if (total > 0) {
        text.append(' ').append(Strings.padStart(format.percent((double) value / total), 4, ' '));
      }
      text.append(' ').append(format.numeric(perSecond, true)).append("/s ]");
      return color && perSecond > 0 ? colored(GREEN, text.toString()) : text.toString();
    });
  }

  /** Adds {@code name: [ count ]}, colored red once the count is above zero. */
  public ProgressLoggers addErrorCounter(String name, LongSupplier count) {
    return addNamed(name, () -> {
      long value = count.getAsLong();
      String text = "[ " + format.numeric(value, false) + " ]";
      return value > 0 ? colored(RED, text) : text;
    });
  }

  public ProgressLoggers add(String text) {
    segments.add(() -> text);
    return this;
  }

  public ProgressLoggers add(Supplier<String> text) {
    segments.add(text);
    return this;
  }

  /** Adds CPUs in use and share of time spent in GC since the last log, and heap usage. */
  public ProgressLoggers addProcessStats() {
    addUtilization("cpus", () -> ProcessInfo.getProcessCpuTime().orElse(Duration.ZERO),
      cpus -> colored(BLUE, format.decimal(cpus)));
    addUtilization("gc", ProcessInfo::getGcTime, share -> {
      String text = format.percent(share);
      if (share > 0.6) {
        return colored(RED, text);
      }
      return share > 0.3 ? colored(YELLOW, text) : text;
    });
    return addNamed("mem", () -> format.storage(ProcessInfo.getUsedMemoryBytes(), false) + "/" +
      format.storage(ProcessInfo.getMaxMemoryBytes(), false));
  }

  /** Adds how much of {@code total} accumulated per nanosecond of wall time since the last log. */
  private void addUtilization(String name, Supplier<Duration> total, DoubleFunction<String> render) {
    Rate rate = new Rate(total.get().toNanos());
    addNamed(name, () -> {
      long nanos = total.get().toNanos();
      return nanos < 0 ? "-" : Strings.padStart(render.apply(rate.update(nanos) / 1e9), 3, ' ');
    });
  }

  /** Adds the CPU share of each thread in {@code worker} since the last log, or {@code -%} once a thread exits. */
  public ProgressLoggers addThreadPoolStats(String name, Worker worker) {
    String prefix = worker.getPrefix();
    Map<Long, ProcessInfo.ThreadState> previous = new TreeMap<>(ProcessInfo.getThreadStats());
    Rate clock = new Rate(0);
    return addNamed(name, () -> {
      Map<Long, ProcessInfo.ThreadState> current = ProcessInfo.getThreadStats();
      double elapsedNanos = Math.max(1, clock.sinceLast());
      Map<Long, ProcessInfo.ThreadState> seen = new TreeMap<>(previous);
      seen.putAll(current);
      String result = seen.values().stream()
        .filter(thread -> thread.name().startsWith(prefix))
        .map(thread -> {
          if (!current.containsKey(thread.id())) {
            return " -%";
          }
          long before = previous.getOrDefault(thread.id(), ProcessInfo.ThreadState.DEFAULT).cpuTime().toNanos();
          return Strings.padStart(format.percent((thread.cpuTime().toNanos() - before) / elapsedNanos), 3, ' ');
        })
        .collect(Collectors.joining(" ", "(", ")"));
      previous.putAll(current);
      return result;
    });
  }

  /** Starts a new, indented line. */
  public ProgressLoggers newLine() {
    return add(System.lineSeparator());
  }

  public void log() {
    LOGGER.info(getLog());
  }

  public String getLog() {
    return segments.stream()
      .map(Supplier::get)
      .collect(Collectors.joining())
      .replaceAll(System.lineSeparator() + "\\s*", System.lineSeparator() + "    ");
  }

  /** Change per second of a monotonic value between successive reads. */
  private static final class Rate {

    private long lastValue;
    private long lastNanos = System.nanoTime();

    Rate(long initial) {
      this.lastValue = initial;
    }

    synchronized long sinceLast() {
      long now = System.nanoTime();
      long elapsed = now - lastNanos;
      lastNanos = now;
      return elapsed;
    }

    /** Returns the change per second since the last update, treating a drop as a reset to zero. */
    synchronized double update(long value) {
      long delta = value >= lastValue ? value - lastValue : value;
      lastValue = value;
      return delta * 1e9 / Math.max(1, sinceLast());
    }
  }
}
