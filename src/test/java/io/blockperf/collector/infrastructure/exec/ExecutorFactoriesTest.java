package io.blockperf.collector.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {
  @Test
  void sinkExecutorUsesNamedDaemonThreads() throws Exception {
    ExecutorService executor = ExecutorFactories.newSinkExecutor(4, "test-sink", null);
    AtomicReference<Thread> worker = new AtomicReference<>();
    CountDownLatch ran = new CountDownLatch(1);
    try {
      executor.execute(() -> {
        worker.set(Thread.currentThread());
        ran.countDown();
      });
      assertTrue(ran.await(5, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }

    assertEquals("test-sink-0", worker.get().getName());
    assertTrue(worker.get().isDaemon());
  }

  @Test
  void sinkExecutorRejectsWhenQueueIsFull() throws Exception {
    ExecutorService executor = ExecutorFactories.newSinkExecutor(1, "test-sink", null);
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    try {
      executor.execute(() -> {
        started.countDown();
        try {
          release.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      });
      assertTrue(started.await(5, TimeUnit.SECONDS));
      executor.execute(() -> { });

      assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> { }));
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
  }

  @Test
  void timerSchedulerDropsPeriodicTasksOnShutdown() throws Exception {
    ScheduledExecutorService scheduler = ExecutorFactories.newTimerScheduler(1, "", null);
    AtomicReference<String> name = new AtomicReference<>();
    CountDownLatch ran = new CountDownLatch(1);
    scheduler.scheduleAtFixedRate(() -> {
      name.set(Thread.currentThread().getName());
      ran.countDown();
    }, 0, 1, TimeUnit.HOURS);
    assertTrue(ran.await(5, TimeUnit.SECONDS));

    scheduler.shutdown();

    assertTrue(scheduler.awaitTermination(5, TimeUnit.SECONDS));
    assertEquals("blockperf-timer-0", name.get());
  }

  @Test
  void rejectsNonPositiveSizes() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newSinkExecutor(0, "x", null));
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newTimerScheduler(0, "x", null));
  }
}
