package com.onthegomap.tilegen.worker;

import com.onthegomap.tilegen.pyramid.TileTask;

/** A message from a worker back to the dispatcher. */
public sealed interface DispatchOutcome {

  /** {@code task} was rendered and written. */
  record Completed(TileTask task) implements DispatchOutcome {}

  /** {@code task} could not be rendered. The worker is still alive. */
  record Failed(TileTask task, String reason) implements DispatchOutcome {}

  /**
   * The worker has exited.
   *
   * @param crash {@code null} when acknowledging {@link WorkerMessage.Shutdown}, otherwise what killed the worker
   */
  record Terminated(Throwable crash) implements DispatchOutcome {

    static final Terminated GRACEFUL = new Terminated(null);

    public boolean crashed() {
      return crash != null;
    }
  }
}
