package io.blockperf.collector.application.pipeline;

import io.blockperf.collector.application.block.BlockCorrelationEngine;
import io.blockperf.collector.application.peer.PeerStateTracker;
import io.blockperf.collector.application.peer.ReconcileResult;
import io.blockperf.collector.application.port.BlockSampleSink;
import io.blockperf.collector.application.port.EventSource;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.application.port.OsConnectionSnapshot;
import io.blockperf.collector.application.port.PeerReporter;
import io.blockperf.collector.application.port.PeerSnapshotQuery;
import io.blockperf.collector.domain.event.NormalizedEvent;
import io.blockperf.collector.domain.peer.OsConnection;
import io.blockperf.collector.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the collector: drains the event source through the {@link EventDispatcher} on the calling thread while a
 * scheduler reconciles peers, sweeps stale block records, and publishes peer reports.
 *
 * <p>Instances are not reusable; invoke {@link #run()} at most once. The loop ends when the thread is interrupted,
 * {@link #stop()} is called, or a finite source is exhausted. Open peer state and block records are discarded on
 * exit.</p>
 *
 * @since 0.1.0
 */
public final class CollectorUseCase {
  private static final Logger log = LoggerFactory.getLogger(CollectorUseCase.class);

  private static final Duration SCHEDULER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final EventSource source;
  private final EventDispatcher dispatcher;
  private final PeerStateTracker peers;
  private final BlockCorrelationEngine blocks;
  private final OsConnectionSnapshot osSnapshot;
  private final PeerReporter reporter;
  private final BlockSampleSink sink;
  private final MetricsPort metrics;
  private final CollectorSettings settings;

  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private volatile boolean stopRequested;
  private long eventCount;

  /**
   * Wires the collector.
   *
   * @param source ordered node trace events
   * @param dispatcher classifier and router for each event
   * @param peers peer tracker, reconciled on a timer
   * @param blocks correlation engine, swept on a timer
   * @param osSnapshot ground truth for reconciliation
   * @param reporter receiver of the periodic peer summary
   * @param sink sample sink, closed on exit
   * @param metrics metrics sink
   * @param settings timer periods
   */
  public CollectorUseCase(
      EventSource source,
      EventDispatcher dispatcher,
      PeerStateTracker peers,
      BlockCorrelationEngine blocks,
      OsConnectionSnapshot osSnapshot,
      PeerReporter reporter,
      BlockSampleSink sink,
      MetricsPort metrics,
      CollectorSettings settings) {
    this.source = Objects.requireNonNull(source, "source");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.peers = Objects.requireNonNull(peers, "peers");
    this.blocks = Objects.requireNonNull(blocks, "blocks");
    this.osSnapshot = Objects.requireNonNull(osSnapshot, "osSnapshot");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Processes events until stopped, interrupted, or the source is exhausted.
   *
   * @throws Exception if the source fails or an internal invariant is violated
   */
  public void run() throws Exception {
    if (!runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Collector already running");
    }
    MDC.put("pipeline", "collector");
    ScheduledExecutorService scheduler =
        ExecutorFactories.newTimerScheduler(
            1,
            "blockperf-timer",
            (thread, ex) -> log.error("Timer thread {} terminated unexpectedly", thread.getName(), ex));
    Exception primaryFailure = null;
    try {
      source.start();
      scheduleTimers(scheduler);
      log.info(
          "Collector started; reconcile every {}s, sweep every {}s, report every {}s",
          settings.reconcileInterval().toSeconds(),
          settings.sweepInterval().toSeconds(),
          settings.reportInterval().toSeconds());

      while (!stopRequested && !Thread.currentThread().isInterrupted()) {
        Optional<NormalizedEvent> next;
        try {
          next = source.poll();
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        }
        if (next.isEmpty()) {
          if (source.isExhausted()) {
            log.info("Event source exhausted");
            break;
          }
          continue;
        }
        eventCount++;
        dispatcher.dispatch(next.get());
      }
    } catch (Exception runFailure) {
      primaryFailure = runFailure;
    } finally {
      shutdownScheduler(scheduler);
      try {
        source.close();
        log.info("Event source closed");
      } catch (Exception sourceCloseFailure) {
        log.error("Failed to close event source", sourceCloseFailure);
        if (primaryFailure == null) {
          primaryFailure = sourceCloseFailure;
        }
      }
      try {
        sink.close();
        log.info("Sample sink closed");
      } catch (Exception sinkCloseFailure) {
        log.error("Failed to close sample sink", sinkCloseFailure);
        if (primaryFailure == null) {
          primaryFailure = sinkCloseFailure;
        }
      }
      log.info(
          "Collector stopped after {} events; discarding {} peers and {} open block records",
          eventCount,
          peers.size(),
          blocks.openRecords());
      MDC.remove("pipeline");
      runThread.set(null);
    }
    if (primaryFailure != null) {
      throw primaryFailure;
    }
  }

  /**
   * Requests the run loop to exit after the current event and interrupts a blocked poll.
   */
  public void stop() {
    stopRequested = true;
    Thread thread = runThread.get();
    if (thread != null) {
      thread.interrupt();
    }
  }

  /**
   * Performs one reconciliation pass. A snapshot failure skips the pass.
   *
   * @return the pass outcome, or empty when the snapshot could not be read
   */
  public Optional<ReconcileResult> reconcileOnce() {
    Set<OsConnection> connections;
    try {
      connections = osSnapshot.establishedConnections();
    } catch (IOException ex) {
      metrics.increment("peers.reconcile.failed");
      log.warn("Skipping peer reconciliation; OS connection snapshot failed: {}", ex.getMessage());
      return Optional.empty();
    }
    ReconcileResult result = peers.reconcile(connections);
    if (result.changed()) {
      log.debug("Reconciled peers: +{} -{} (total {})", result.added(), result.removed(), result.total());
    }
    return Optional.of(result);
  }

  /**
   * Performs one staleness sweep.
   *
   * @return number of records removed
   */
  public int sweepOnce() {
    return blocks.sweep();
  }

  /**
   * Publishes one peer summary.
   */
  public void reportOnce() {
    reporter.report(peers.statistics(), blocks.openRecords());
  }

  /** Read-only view of the tracked peers for status reporting. */
  public PeerSnapshotQuery peerSnapshot() {
    return peers;
  }

  /** Number of events dispatched so far; only meaningful after {@link #run()} returns. */
  public long eventCount() {
    return eventCount;
  }

  private void scheduleTimers(ScheduledExecutorService scheduler) {
    schedule(scheduler, "reconcile", settings.reconcileInterval(), this::reconcileOnce);
    schedule(scheduler, "sweep", settings.sweepInterval(), this::sweepOnce);
    schedule(scheduler, "report", settings.reportInterval(), this::reportOnce);
  }

  private void schedule(ScheduledExecutorService scheduler, String name, Duration period, Runnable task) {
    long millis = period.toMillis();
    scheduler.scheduleAtFixedRate(() -> runTimer(name, task), millis, millis, TimeUnit.MILLISECONDS);
  }

  // A periodic task that throws is cancelled by the scheduler, so failures stop here.
  private void runTimer(String name, Runnable task) {
    MDC.put("pipeline", name);
    try {
      task.run();
    } catch (RuntimeException ex) {
      metrics.increment("collector.timer.failed");
      log.error("{} timer failed", name, ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void shutdownScheduler(ScheduledExecutorService scheduler) {
    scheduler.shutdownNow();
    try {
      if (!scheduler.awaitTermination(SCHEDULER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Timer threads did not terminate within {}", SCHEDULER_SHUTDOWN_TIMEOUT);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for timer threads to stop");
    }
  }
}
