package com.onthegomap.tilegen.stats;

import com.sun.management.OperatingSystemMXBean;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads CPU, GC, memory and per-thread CPU figures from the JVM management beans.
 */
public final class ProcessInfo {

  private ProcessInfo() {}

  /** Returns the CPU time this process has used, or empty if the JVM does not expose it. */
  public static Optional<Duration> getProcessCpuTime() {
    if (ManagementFactory.getOperatingSystemMXBean() instanceof OperatingSystemMXBean os) {
      long nanos = os.getProcessCpuTime();
      return nanos < 0 ? Optional.empty() : Optional.of(Duration.ofNanos(nanos));
    }
    return Optional.empty();
  }

  /** Returns the heap limit set by {@code -Xmx}. */
  public static long getMaxMemoryBytes() {
    return Runtime.getRuntime().maxMemory();
  }

  public static long getUsedMemoryBytes() {
    Runtime runtime = Runtime.getRuntime();
    return runtime.totalMemory() - runtime.freeMemory();
  }

  /** Returns the time spent in every garbage collector since the JVM started. */
  public static Duration getGcTime() {
    long millis = ManagementFactory.getGarbageCollectorMXBeans().stream()
      .mapToLong(GarbageCollectorMXBean::getCollectionTime)
      .filter(time -> time > 0)
      .sum();
    return Duration.ofMillis(millis);
  }

  /** CPU time used so far by one thread. */
  public record ThreadState(long id, String name, Duration cpuTime) {

    public static final ThreadState DEFAULT = new ThreadState(-1, "", Duration.ZERO);

    static ThreadState of(ThreadMXBean bean, ThreadInfo thread) {
      long nanos = bean.isThreadCpuTimeSupported() ? bean.getThreadCpuTime(thread.getThreadId()) : 0;
      return new ThreadState(thread.getThreadId(), thread.getThreadName(), Duration.ofNanos(Math.max(0, nanos)));
    }
  }

  /** Returns the state of every live thread keyed by thread ID. */
  public static Map<Long, ThreadState> getThreadStats() {
    ThreadMXBean bean = ManagementFactory.getThreadMXBean();
    Map<Long, ThreadState> result = new TreeMap<>();
    for (ThreadInfo thread : bean.dumpAllThreads(false, false)) {
      result.put(thread.getThreadId(), ThreadState.of(bean, thread));
    }
    return result;
  }

  /** Returns the state of the calling thread. */
  public static ThreadState getCurrentThreadState() {
    ThreadMXBean bean = ManagementFactory.getThreadMXBean();
    ThreadInfo thread = bean.getThreadInfo(Thread.currentThread().getId());
    return thread == null ? ThreadState.DEFAULT : ThreadState.of(bean, thread);
  }
}
