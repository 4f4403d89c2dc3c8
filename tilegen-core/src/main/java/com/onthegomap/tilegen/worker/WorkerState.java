package com.onthegomap.tilegen.worker;

/** Lifecycle of one tile worker as seen by the dispatcher. */
public enum WorkerState {
  /** Not yet sent a message. */
  IDLE,
  /** Rendering the tile it was last sent. */
  BUSY,
  /** Sent {@link WorkerMessage.Shutdown} and waiting for it to acknowledge. */
  SHUTTING_DOWN,
  /** Exited, either gracefully or by crashing. */
  TERMINATED
}
