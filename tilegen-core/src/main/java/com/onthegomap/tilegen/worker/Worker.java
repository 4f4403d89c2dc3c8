package com.onthegomap.tilegen.worker;

import static com.onthegomap.tilegen.util.Exceptions.throwFatalException;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.onthegomap.tilegen.stats.Stats;
import com.onthegomap.tilegen.util.LogUtil;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed set of daemon threads named {@code prefix-1 .. prefix-N} that each run the same task once, given their
 * zero-based index.
 * <p>
 * {@link #done()} completes when every thread returns, or fails as soon as the first one throws.
 */
public class Worker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);
  private static final ThreadFactory THREADS = new ThreadFactoryBuilder().setDaemon(true).build();

  private final String prefix;
  private final CompletableFuture<Void> done = new CompletableFuture<>();
  private final AtomicInteger running;
  private final AtomicBoolean failureLogged = new AtomicBoolean(false);

  /** The body of one worker thread. */
  @FunctionalInterface
  public interface Task {

    void run(int index) throws Exception;
  }

  /**
   * Starts {@code threads} threads immediately.
   *
   * @param prefix  thread name prefix, also used for the log stage and thread timings
   * @param stats   where each thread records its CPU time when it finishes
   * @param threads number of threads to start
   * @param task    what each thread runs
   */
  public Worker(String prefix, Stats stats, int threads, Task task) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    this.prefix = prefix;
    this.running = new AtomicInteger(threads);
    String parentStage = LogUtil.getStage();
    for (int i = 0; i < threads; i++) {
      int index = i;
      Thread thread = THREADS.newThread(() -> runThread(index, parentStage, stats, task));
      thread.setName(prefix + "-" + (i + 1));
      thread.start();
    }
  }

  @SuppressWarnings("java:S1181")
  private void runThread(int index, String parentStage, Stats stats, Task task) {
    LogUtil.setStage(parentStage, Thread.currentThread().getName());
    long start = System.nanoTime();
    try {
      task.run(index);
      stats.timers().finishedWorker(prefix, Duration.ofNanos(System.nanoTime() - start));
      if (running.decrementAndGet() == 0) {
        done.complete(null);
      }
    } catch (Throwable e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      // one failure tends to cascade, only the first is worth a stack trace
      if (failureLogged.compareAndSet(false, true)) {
        LOGGER.error("Worker {} died", Thread.currentThread().getName(), e);
      }
      done.completeExceptionally(e);
    }
  }

  public String getPrefix() {
    return prefix;
  }

  public CompletableFuture<Void> done() {
    return done;
  }

  /**
   * Blocks until every thread has returned.
   *
   * @throws RuntimeException the first failure from a worker thread, or if interrupted while waiting
   */
  public void await() {
    try {
      done.get();
    } catch (ExecutionException e) {
      throwFatalException(e.getCause());
    } catch (InterruptedException e) {
      throwFatalException(e);
    }
  }
}
