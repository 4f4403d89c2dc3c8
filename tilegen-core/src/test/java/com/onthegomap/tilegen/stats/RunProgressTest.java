package com.onthegomap.tilegen.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class RunProgressTest {

  private final AtomicLong clock = new AtomicLong(1_000);

  private void advanceSeconds(long seconds) {
    clock.addAndGet(TimeUnit.SECONDS.toNanos(seconds));
  }

  @Test
  void testCounts() {
    var progress = new RunProgress(10, clock::get);
    progress.recordCompleted();
    progress.recordFailed();
    progress.recordCompleted();
    assertEquals(3, progress.completedCount());
    assertEquals(1, progress.failedCount());
    assertEquals(10, progress.totalCount());
    assertEquals(30, progress.percent());
  }

  @Test
  void testThroughputAndEta() {
    var progress = new RunProgress(10, clock::get);
    assertEquals(0, progress.throughput());
    assertEquals(0, progress.etaSeconds());
    for (int i = 0; i < 4; i++) {
      progress.recordCompleted();
    }
    progress.recordFailed();
    advanceSeconds(2);
    assertEquals(Duration.ofSeconds(2), progress.elapsed());
    assertEquals(2.5, progress.throughput(), 1e-9);
    assertEquals(2, progress.etaSeconds(), 1e-9);
  }

  @Test
  void testNoThroughputBeforeAnyTileFinishes() {
    var progress = new RunProgress(10, clock::get);
    advanceSeconds(5);
    assertEquals(0, progress.throughput());
    assertEquals(0, progress.etaSeconds());
  }

  @Test
  void testBar() {
    var progress = new RunProgress(4, clock::get);
    assertEquals("░".repeat(RunProgress.BAR_WIDTH), progress.bar());
    progress.recordCompleted();
    assertEquals("█".repeat(10) + "░".repeat(30), progress.bar());
    progress.recordCompleted();
    progress.recordCompleted();
    progress.recordFailed();
    assertEquals("█".repeat(RunProgress.BAR_WIDTH), progress.bar());
  }

  @Test
  void testRender() {
    var progress = new RunProgress(10, clock::get);
    for (int i = 0; i < 5; i++) {
      progress.recordCompleted();
    }
    advanceSeconds(2);
    assertEquals(
      "█".repeat(20) + "░".repeat(20) + "  50% (5/10) 2.5 tiles/s elapsed 00:00:02 eta 00:00:02",
      progress.render()
    );
    assertEquals(progress.render(), progress.toString());
  }

  @Test
  void testEmptyRunIsComplete() {
    var progress = new RunProgress(0, clock::get);
    assertEquals(100, progress.percent());
    assertEquals("█".repeat(RunProgress.BAR_WIDTH), progress.bar());
    assertEquals(0, progress.etaSeconds());
    assertThrows(IllegalStateException.class, progress::recordCompleted);
  }

  @Test
  void testMoreOutcomesThanTasks() {
    var progress = new RunProgress(1, clock::get);
    progress.recordFailed();
    assertThrows(IllegalStateException.class, progress::recordCompleted);
    assertThrows(IllegalStateException.class, progress::recordFailed);
    assertEquals(1, progress.completedCount());
    assertEquals(1, progress.failedCount());
  }

  @Test
  void testNegativeTotal() {
    assertThrows(IllegalArgumentException.class, () -> new RunProgress(-1, clock::get));
  }

  @Test
  void testStartUsesSystemClock() {
    var progress = RunProgress.start(3);
    assertEquals(0, progress.completedCount());
    assertEquals(false, progress.elapsed().isNegative());
  }
}
