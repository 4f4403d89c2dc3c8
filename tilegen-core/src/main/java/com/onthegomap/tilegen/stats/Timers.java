package com.onthegomap.tilegen.stats;

import com.google.common.base.Strings;
import com.onthegomap.tilegen.util.Format;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wall and CPU timings of each stage of a run, in the order the stages started, along with the CPU time of the worker
 * threads that ran inside each one.
 */
@ThreadSafe
public class Timers {

  private static final Logger LOGGER = LoggerFactory.getLogger(Timers.class);
  private static final Format FORMAT = Format.defaultInstance();

  private final Map<String, Stage> stages = Collections.synchronizedMap(new LinkedHashMap<>());
  private final AtomicReference<Stage> current = new AtomicReference<>();

  /**
   * Starts timing {@code name}. Worker threads that finish before the returned handle is stopped are attributed to this
   * stage.
   */
  public Finishable startTimer(String name, boolean log) {
    Stage stage = new Stage(Timer.start());
    stages.put(name, stage);
    Stage outer = current.getAndSet(stage);
    if (log) {
      LOGGER.info("Starting...");
    }
    return () -> {
      stage.timer.stop();
      if (log) {
        LOGGER.info("Finished in {}", stage.timer);
        for (String line : poolSummaries(name, stage)) {
          LOGGER.info("  {}", line);
        }
      }
      current.set(outer);
    };
  }

  /** Records the CPU time of the calling thread, which belongs to {@code pool} and ran for {@code elapsed}. */
  public void finishedWorker(String pool, Duration elapsed) {
    Stage stage = current.get();
    if (stage != null) {
      stage.threadStats.add(new ThreadInfo(ProcessInfo.getCurrentThreadState(), pool, elapsed));
    }
  }

  /** Logs one line per stage, with a breakdown by worker pool for stages longer than a second. */
  public void printSummary() {
    Map<String, Stage> snapshot = all();
    int width = snapshot.keySet().stream().mapToInt(String::length).max().orElse(0);
    snapshot.forEach((name, stage) -> {
      ProcessTime elapsed = stage.timer.elapsed();
      LOGGER.info("\t{} {}", Strings.padEnd(name, width, ' '), elapsed);
      if (elapsed.wall().compareTo(Duration.ofSeconds(1)) > 0) {
        for (String line : poolSummaries(name, stage)) {
          LOGGER.info("\t  {}", line);
        }
      }
    });
  }

  /** Returns lines like {@code render  4x(96% 12s done:1s)}: threads, CPU share, CPU per thread, idle at the end. */
  private static List<String> poolSummaries(String stageName, Stage stage) {
    Duration wall = stage.timer.elapsed().wall();
    Map<String, List<ThreadInfo>> byPool = stage.threadStats.stream()
      .collect(Collectors.groupingBy(ThreadInfo::pool, LinkedHashMap::new, Collectors.toList()));
    List<String> lines = new ArrayList<>();
    byPool.forEach((pool, threads) -> {
      int count = threads.size();
      Duration cpu = threads.stream().map(t -> t.state().cpuTime()).reduce(Duration.ZERO, Duration::plus);
      Duration busy = threads.stream().map(ThreadInfo::elapsed).reduce(Duration.ZERO, Duration::plus).dividedBy(count);
      double share = cpu.toNanos() / (double) Math.max(1, wall.multipliedBy(count).toNanos());
      StringBuilder line = new StringBuilder(StringUtils.removeStart(pool, stageName + "_"))
        .append(Strings.padStart(Integer.toString(count), 3, ' '))
        .append("x(")
        .append(FORMAT.percent(share))
        .append(' ')
        .append(FORMAT.duration(cpu.dividedBy(count)));
      Duration idle = wall.minus(busy);
      if (idle.compareTo(Duration.ofSeconds(1)) > 0) {
        line.append(" done:").append(FORMAT.duration(idle));
      }
      lines.add(line.append(')').toString());
    });
    return lines;
  }

  /** Returns a snapshot of every stage started so far. */
  public Map<String, Stage> all() {
    synchronized (stages) {
      return new LinkedHashMap<>(stages);
    }
  }

  /** Handle for marking a stage finished. */
  public interface Finishable {

    void stop();
  }

  record ThreadInfo(ProcessInfo.ThreadState state, String pool, Duration elapsed) {}

  /** A timed stage and the worker threads that finished during it. */
  public record Stage(Timer timer, List<ThreadInfo> threadStats) {

    Stage(Timer timer) {
      this(timer, new CopyOnWriteArrayList<>());
    }
  }
}
