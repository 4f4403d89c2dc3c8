package com.onthegomap.tilegen.stats;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Measures the amount of wall and CPU time that a stage takes.
 */
@ThreadSafe
public class Timer {

  private final ProcessTime start;
  private volatile ProcessTime end;

  private Timer() {
    start = ProcessTime.now();
  }

  public static Timer start() {
    return new Timer();
  }

  /** Sets the end time to now. Calling again moves the end time forward. */
  public Timer stop() {
    synchronized (this) {
      end = ProcessTime.now();
    }
    return this;
  }

  /** Returns {@code false} once {@link #stop()} has been called. */
  public boolean running() {
    synchronized (this) {
      return end == null;
    }
  }

  /** Returns the time from start to now while running, or start to end once stopped. */
  public ProcessTime elapsed() {
    synchronized (this) {
      return (end == null ? ProcessTime.now() : end).minus(start);
    }
  }

  @Override
  public String toString() {
    return elapsed().toString();
  }
}
