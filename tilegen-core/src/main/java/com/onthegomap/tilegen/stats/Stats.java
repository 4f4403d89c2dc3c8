package com.onthegomap.tilegen.stats;

import com.onthegomap.tilegen.util.FileUtils;
import com.onthegomap.tilegen.util.Format;
import com.onthegomap.tilegen.util.LogUtil;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects statistics about a tile generation run that are reported at the end of the job: how long each stage took,
 * how many tiles were written at each zoom level and how big they were, and the size of output files.
 */
public interface Stats extends AutoCloseable {

  /** Returns a new stat collector that stores stats in-memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /** Logs stage timings, per-zoom tile counts and sizes, and the size of monitored files. */
  default void printSummary() {
    Format format = Format.defaultInstance();
    Logger logger = LoggerFactory.getLogger(getClass());
    logger.info("");
    logger.info("-".repeat(40));
    timers().printSummary();
    logger.info("-".repeat(40));
    for (var entry : tileStats().entrySet()) {
      var sizes = entry.getValue();
      logger.info("\tz{}\t{} tiles\t{}B", entry.getKey(), format.integer(sizes.count().sum()),
        format.storage(sizes.bytes().sum(), false));
    }
    for (var entry : monitoredFiles().entrySet()) {
      long size = FileUtils.size(entry.getValue());
      if (size > 0) {
        logger.info("\t{}\t{}B", entry.getKey(), format.storage(size, false));
      }
    }
  }

  /**
   * Records that a stage with {@code name} has started and returns a handle to call when finished.
   * <p>
   * Also sets the "stage" prefix that shows up in the logs to {@code name}.
   */
  default Timers.Finishable startStage(String name) {
    return startStage(name, true);
  }

  /** Same as {@link #startStage(String)} when {@code log} is true, otherwise times the stage silently. */
  default Timers.Finishable startStage(String name, boolean log) {
    if (log) {
      LogUtil.setStage(name);
    }
    var timer = timers().startTimer(name, log);
    return () -> {
      timer.stop();
      if (log) {
        LogUtil.clearStage();
      }
    };
  }

  /** Records that a tile was written at {@code zoom} with an encoded size of {@code bytes}. */
  void wroteTile(int zoom, int bytes);

  /** Returns tile counts and sizes by zoom level recorded through {@link #wroteTile(int, int)}. */
  Map<Integer, TileSizes> tileStats();

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /** Returns all the files being monitored. */
  Map<String, Path> monitoredFiles();

  /** Adds a stat that will track the size of a file or directory located at {@code path}. */
  default void monitorFile(String name, Path path) {
    monitoredFiles().put(name, path);
  }

  @Override
  void close();

  /** Number of tiles and total encoded bytes written at one zoom level. */
  record TileSizes(LongAdder count, LongAdder bytes) {

    TileSizes() {
      this(new LongAdder(), new LongAdder());
    }
  }

  /** A stat collector that keeps everything in memory to report through {@link #printSummary()}. */
  class InMemory implements Stats {

    /** use {@link #inMemory()} */
    private InMemory() {}

    private final Timers timers = new Timers();
    private final Map<String, Path> monitoredFiles = new ConcurrentSkipListMap<>();
    private final Map<Integer, TileSizes> tileStats = new ConcurrentSkipListMap<>();

    @Override
    public void wroteTile(int zoom, int bytes) {
      var sizes = tileStats.computeIfAbsent(zoom, z -> new TileSizes());
      sizes.count().increment();
      sizes.bytes().add(bytes);
    }

    @Override
    public Map<Integer, TileSizes> tileStats() {
      return tileStats;
    }

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public Map<String, Path> monitoredFiles() {
      return monitoredFiles;
    }

    @Override
    public void close() {
      // nothing to release
    }
  }
}
