package io.blockperf.collector.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the collector's named background threads.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds the scheduler running reconcile, sweep, and report timers.
   *
   * @param size number of timer threads
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread
   * @return configured scheduler; periodic tasks are dropped on shutdown
   */
  public static ScheduledExecutorService newTimerScheduler(
      int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(size, threadFactory(prefix, "blockperf-timer", handler));
    scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  /**
   * Builds a single-thread executor with a bounded queue for asynchronous sink delivery.
   *
   * @param queueCapacity maximum pending deliveries; further submissions are rejected
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the thread
   * @return configured executor using {@link ThreadPoolExecutor.AbortPolicy}
   */
  public static ExecutorService newSinkExecutor(
      int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(queueCapacity),
        threadFactory(prefix, "blockperf-sink", handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds the single daemon thread that drains a child process's output for an event source.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the thread
   * @return single-thread executor
   */
  public static ExecutorService newSourceReader(String prefix, UncaughtExceptionHandler handler) {
    return Executors.newSingleThreadExecutor(threadFactory(prefix, "blockperf-source", handler));
  }

  private static ThreadFactory threadFactory(String prefix, String fallback, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(
        handler, (t, ex) -> log.error("Uncaught failure on thread {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
