package com.onthegomap.tilegen.worker;

import static com.onthegomap.tilegen.util.Exceptions.throwFatalException;

import com.onthegomap.tilegen.pyramid.TileTask;
import com.onthegomap.tilegen.stats.ProgressLoggers;
import com.onthegomap.tilegen.stats.RunProgress;
import com.onthegomap.tilegen.stats.Stats;
import com.onthegomap.tilegen.util.Exceptions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Distributes a fixed list of tiles across a pool of {@link TileWorker} threads and waits until every worker has
 * exited.
 * <p>
 * Each worker holds at most one task at a time: it gets a new task as soon as it reports the previous one, or
 * {@link WorkerMessage.Shutdown} once nothing is left. All counters and worker states live on the thread that calls
 * {@link #run()}; workers only read their own inbox and post to the shared outbox. A failed tile is never retried, and
 * a crashed worker is not replaced.
 */
public class TileDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileDispatcher.class);
  public static final String WORKER_PREFIX = "render";

  private final List<TileTask> tasks;
  private final TileHandler handler;
  private final int threads;
  private final Stats stats;
  private final Duration logInterval;
  private final Duration timeout;
  private volatile boolean cancelled = false;

  // control thread state
  private final List<BlockingQueue<WorkerMessage>> inboxes = new ArrayList<>();
  private final BlockingQueue<TileWorker.Report> outbox = new LinkedBlockingQueue<>();
  private final WorkerState[] states;
  private final TileTask[] inFlight;
  private final List<DispatchOutcome.Failed> failures = new ArrayList<>();
  private RunProgress progress;
  private int taskIndex = 0;
  private int activeWorkers;
  private boolean started = false;

  /**
   * @param tasks       every tile to render, each dispatched at most once
   * @param handler     renders one tile, called concurrently from all workers
   * @param threads     number of workers
   * @param stats       where to record worker thread timings
   * @param logInterval how often to log progress while waiting
   * @param timeout     stop dispatching new tiles after this long, or {@code null} for no limit
   */
  public TileDispatcher(List<TileTask> tasks, TileHandler handler, int threads, Stats stats, Duration logInterval,
    Duration timeout) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    if (logInterval.isNegative() || logInterval.isZero()) {
      throw new IllegalArgumentException("logInterval must be positive, was " + logInterval);
    }
    this.tasks = List.copyOf(tasks);
    this.handler = handler;
    this.threads = threads;
    this.stats = stats;
    this.logInterval = logInterval;
    this.timeout = timeout;
    this.states = new WorkerState[threads];
    this.inFlight = new TileTask[threads];
  }

  /**
   * Stops handing out new tiles. Tiles already being rendered finish, then every worker shuts down and the remaining
   * tiles are reported as skipped. Safe to call from any thread.
   */
  public void cancel() {
    if (!cancelled) {
      cancelled = true;
      LOGGER.warn("Cancelling, no new tiles will be dispatched");
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Renders every tile and blocks until all workers have exited.
   *
   * @return counts of completed, failed and skipped tiles
   * @throws IllegalStateException if a worker reports an outcome that does not match what it was sent, or if the final
   *                               counts do not add up
   */
  public DispatchSummary run() {
    if (started) {
      throw new IllegalStateException("A dispatcher can only run once");
    }
    started = true;
    int total = tasks.size();
    progress = RunProgress.start(total);
    activeWorkers = threads;
    for (int i = 0; i < threads; i++) {
      inboxes.add(new ArrayBlockingQueue<>(1));
      states[i] = WorkerState.IDLE;
    }
    long deadline = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();

    Worker pool = new Worker(WORKER_PREFIX, stats, threads,
      id -> new TileWorker(id, inboxes.get(id), outbox, handler).run());

    ProgressLoggers loggers = ProgressLoggers.create()
      .addRatePercentCounter("tiles", total, progress::completedCount, true)
      .addErrorCounter("failed", progress::failedCount)
      .newLine()
      .add(() -> "    " + progress.render())
      .newLine()
      .addProcessStats()
      .newLine()
      .addThreadPoolStats("render", pool);

    for (int i = 0; i < threads; i++) {
      dispatch(i);
    }

    long nextLog = System.nanoTime() + logInterval.toNanos();
    while (activeWorkers > 0) {
      long now = System.nanoTime();
      if (now >= deadline) {
        LOGGER.warn("Timed out after {}", timeout);
        cancel();
        deadline = Long.MAX_VALUE;
      }
      long wait = Math.max(0, Math.min(nextLog, deadline) - now);
      TileWorker.Report report;
      try {
        report = outbox.poll(wait, TimeUnit.NANOSECONDS);
      } catch (InterruptedException e) {
        cancel();
        return throwFatalException(e);
      }
      if (report != null) {
        handle(report);
      } else if (pool.done().isCompletedExceptionally() && outbox.isEmpty()) {
        // a worker thread died without reporting, so nobody will report for it
        cancel();
        pool.await();
      }
      if (System.nanoTime() >= nextLog) {
        loggers.log();
        nextLog = System.nanoTime() + logInterval.toNanos();
      }
    }
    pool.await();
    loggers.log();

    long skipped = (long) total - taskIndex;
    if (progress.completedCount() + skipped != total) {
      throw new IllegalStateException("Internal error: " + progress.completedCount() + " completed + " + skipped +
        " skipped != " + total + " total");
    }
    if (skipped > 0) {
      LOGGER.warn("Skipped {} tiles that were never dispatched", skipped);
    }
    return new DispatchSummary(total, progress.completedCount(), progress.failedCount(), skipped, failures,
      progress.elapsed());
  }

  private void dispatch(int workerId) {
    WorkerMessage message;
    if (taskIndex < tasks.size() && !cancelled) {
      TileTask task = tasks.get(taskIndex++);
      inFlight[workerId] = task;
      states[workerId] = WorkerState.BUSY;
      message = new WorkerMessage.RunTask(task);
    } else {
      inFlight[workerId] = null;
      states[workerId] = WorkerState.SHUTTING_DOWN;
      message = WorkerMessage.Shutdown.INSTANCE;
    }
    if (!inboxes.get(workerId).offer(message)) {
      throw new IllegalStateException("Worker " + workerId + " inbox is full");
    }
  }

  private void handle(TileWorker.Report report) {
    int id = report.workerId();
    DispatchOutcome outcome = report.outcome();
    if (outcome instanceof DispatchOutcome.Completed completed) {
      expectBusyWith(id, completed.task(), outcome);
      progress.recordCompleted();
      dispatch(id);
    } else if (outcome instanceof DispatchOutcome.Failed failed) {
      expectBusyWith(id, failed.task(), outcome);
      failures.add(failed);
      progress.recordFailed();
      dispatch(id);
    } else if (outcome instanceof DispatchOutcome.Terminated terminated) {
      if (states[id] == WorkerState.BUSY) {
        TileTask lost = inFlight[id];
        String reason = "worker crashed: " + Exceptions.describe(terminated.crash() != null ? terminated.crash() :
          new IllegalStateException("terminated while busy"));
        LOGGER.error("Worker {} died while rendering {}, {} workers left", id, lost, activeWorkers - 1);
        failures.add(new DispatchOutcome.Failed(lost, reason));
        progress.recordFailed();
      } else if (states[id] != WorkerState.SHUTTING_DOWN) {
        throw new IllegalStateException("Worker " + id + " terminated in state " + states[id]);
      } else if (terminated.crashed()) {
        LOGGER.warn("Worker {} failed while shutting down: {}", id, Exceptions.describe(terminated.crash()));
      }
      inFlight[id] = null;
      states[id] = WorkerState.TERMINATED;
      activeWorkers--;
    } else {
      throw new IllegalStateException("Unknown outcome " + outcome + " from worker " + id);
    }
  }

  private void expectBusyWith(int id, TileTask task, DispatchOutcome outcome) {
    if (states[id] != WorkerState.BUSY || !task.equals(inFlight[id])) {
      throw new IllegalStateException(
        "Unexpected " + outcome + " from worker " + id + " in state " + states[id] + " running " + inFlight[id]);
    }
    inFlight[id] = null;
    states[id] = WorkerState.IDLE;
  }

  /** Returns the number of tiles sent to a worker so far. */
  int dispatchedCount() {
    return taskIndex;
  }
}
