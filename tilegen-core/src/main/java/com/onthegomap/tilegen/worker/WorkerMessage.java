package com.onthegomap.tilegen.worker;

import com.onthegomap.tilegen.pyramid.TileTask;

/** A message from the dispatcher to one worker. */
public sealed interface WorkerMessage {

  /** Render {@code task} and report the outcome. */
  record RunTask(TileTask task) implements WorkerMessage {}

  /** No more work: acknowledge with {@link DispatchOutcome.Terminated} and exit. */
  enum Shutdown implements WorkerMessage {
    INSTANCE
  }
}
