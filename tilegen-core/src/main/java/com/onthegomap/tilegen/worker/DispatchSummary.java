package com.onthegomap.tilegen.worker;

import java.time.Duration;
import java.util.List;

/**
 * Final tally of a dispatch run.
 *
 * @param totalCount     number of tasks in the run
 * @param completedCount tasks that reached a terminal outcome, including failures
 * @param failedCount    tasks that failed or were lost to a crashed worker
 * @param skippedCount   tasks never dispatched because the run was cancelled or every worker died
 * @param failures       each failure in the order it was received
 * @param elapsed        wall time from the first dispatch until every worker exited
 */
public record DispatchSummary(
  long totalCount,
  long completedCount,
  long failedCount,
  long skippedCount,
  List<DispatchOutcome.Failed> failures,
  Duration elapsed
) {

  public DispatchSummary {
    failures = List.copyOf(failures);
  }

  /** Returns the number of tiles written successfully. */
  public long succeededCount() {
    return completedCount - failedCount;
  }

  /** Returns true if every task was dispatched and none failed. */
  public boolean isSuccess() {
    return failedCount == 0 && skippedCount == 0;
  }
}
