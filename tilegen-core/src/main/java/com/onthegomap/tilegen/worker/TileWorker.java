package com.onthegomap.tilegen.worker;

import com.onthegomap.tilegen.pyramid.TileTask;
import com.onthegomap.tilegen.util.Exceptions;
import java.util.concurrent.BlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One render thread's message loop: takes {@link WorkerMessage}s from its own inbox, renders tiles through a
 * {@link TileHandler} and posts a {@link DispatchOutcome} for each message to the shared outbox.
 * <p>
 * An exception from a tile is reported as {@link DispatchOutcome.Failed} and the worker keeps going. An {@link Error}
 * is fatal to the worker: it reports {@link DispatchOutcome.Terminated} with the cause and exits.
 */
class TileWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileWorker.class);

  private final int id;
  private final BlockingQueue<WorkerMessage> inbox;
  private final BlockingQueue<Report> outbox;
  private final TileHandler handler;

  /** An outcome tagged with the worker that produced it. */
  record Report(int workerId, DispatchOutcome outcome) {}

  TileWorker(int id, BlockingQueue<WorkerMessage> inbox, BlockingQueue<Report> outbox, TileHandler handler) {
    this.id = id;
    this.inbox = inbox;
    this.outbox = outbox;
    this.handler = handler;
  }

  /** Processes messages until told to shut down or until a task throws an {@link Error}. */
  @SuppressWarnings("java:S1181")
  void run() {
    try {
      while (true) {
        WorkerMessage message = inbox.take();
        if (message instanceof WorkerMessage.RunTask run) {
          TileTask task = run.task();
          try {
            handler.handle(task);
            post(new DispatchOutcome.Completed(task));
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Worker {} interrupted rendering tile {}", id, task);
            post(new DispatchOutcome.Terminated(e));
            return;
          } catch (Exception e) {
            LOGGER.warn("Error rendering tile {}", task, e);
            post(new DispatchOutcome.Failed(task, Exceptions.describe(e)));
          } catch (Error e) {
            LOGGER.error("Worker {} crashed rendering tile {}", id, task, e);
            post(new DispatchOutcome.Terminated(e));
            return;
          }
        } else if (message == WorkerMessage.Shutdown.INSTANCE) {
          post(DispatchOutcome.Terminated.GRACEFUL);
          return;
        } else {
          throw new IllegalStateException("Unexpected message: " + message);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Worker {} interrupted", id);
      post(new DispatchOutcome.Terminated(e));
    } catch (RuntimeException e) {
      post(new DispatchOutcome.Terminated(e));
      throw e;
    }
  }

  private void post(DispatchOutcome outcome) {
    // the outbox is unbounded so this never blocks
    if (!outbox.offer(new Report(id, outcome))) {
      throw new IllegalStateException("Outbox rejected " + outcome);
    }
  }
}
