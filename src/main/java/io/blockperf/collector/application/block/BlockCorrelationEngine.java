package io.blockperf.collector.application.block;

import io.blockperf.collector.application.port.BlockSampleSink;
import io.blockperf.collector.application.port.ClockPort;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.application.port.NetworkConfig;
import io.blockperf.collector.domain.block.BlockRecord;
import io.blockperf.collector.domain.block.BlockSample;
import io.blockperf.collector.domain.block.Sighting;
import io.blockperf.collector.domain.net.Endpoint;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Correlates block events scattered over time into one {@link BlockSample} per block hash.
 * <p><strong>Why:</strong> Header, fetch, download, and adoption of a block are traced by different node subsystems;
 * the propagation deltas only exist once all four milestones are joined.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open a {@link BlockRecord} per hash and set each milestone at most once (first writer wins).</li>
 *   <li>Finalize on adoption: compute deltas, emit to the sink, and drop the record.</li>
 *   <li>Sweep unadopted records older than the staleness threshold without emitting them.</li>
 *   <li>Remember retired hashes so late or repeated events never reopen or re-emit a block.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All table access holds an internal {@link ReentrantLock}; the sink is invoked
 * after the lock is released so a slow sink cannot stall the sweep timer.</p>
 * <p><strong>Observability:</strong> Emits {@code block.*} counters and {@code block.delta.*.millis}
 * observations.</p>
 *
 * @since 0.1.0
 */
public final class BlockCorrelationEngine {
  private static final Logger log = LoggerFactory.getLogger(BlockCorrelationEngine.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, BlockRecord> open = new LinkedHashMap<>();
  private final RetiredHashes retired;
  private final NetworkConfig network;
  private final SampleMetadata metadata;
  private final BlockSampleSink sink;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Duration staleAfter;

  /**
   * Creates an engine with default settings.
   */
  public BlockCorrelationEngine(
      NetworkConfig network,
      SampleMetadata metadata,
      BlockSampleSink sink,
      ClockPort clock,
      MetricsPort metrics) {
    this(network, metadata, sink, clock, metrics, BlockCorrelationSettings.defaults());
  }

  /**
   * Creates an engine.
   *
   * @param network slot time model and magic
   * @param metadata version and local endpoint stamped on samples
   * @param sink receiver of finalized samples
   * @param clock collector clock used to age open records
   * @param metrics metrics sink
   * @param settings staleness and retired-hash tuning
   */
  public BlockCorrelationEngine(
      NetworkConfig network,
      SampleMetadata metadata,
      BlockSampleSink sink,
      ClockPort clock,
      MetricsPort metrics,
      BlockCorrelationSettings settings) {
    this.network = Objects.requireNonNull(network, "network");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    BlockCorrelationSettings effective = Objects.requireNonNull(settings, "settings");
    this.staleAfter = effective.staleAfter();
    this.retired = new RetiredHashes(effective.retiredHashCapacity());
  }

  /**
   * Records the first header sighting, opening the record when absent.
   */
  public void onHeaderSeen(
      String blockHash, long blockNo, long slotNo, long blockSize, Endpoint remote, Instant t) {
    Objects.requireNonNull(remote, "remote");
    Objects.requireNonNull(t, "t");
    lock.lock();
    try {
      if (isRetired(blockHash)) {
        return;
      }
      BlockRecord record = openRecord(blockHash);
      if (!record.recordHeader(blockNo, slotNo, blockSize, remote, t)) {
        metrics.increment("block.header.duplicate");
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records the fetch request; ignored unless a record for the hash is open.
   */
  public void onFetchRequested(String blockHash, Instant t) {
    Objects.requireNonNull(t, "t");
    lock.lock();
    try {
      if (isRetired(blockHash)) {
        return;
      }
      BlockRecord record = open.get(blockHash);
      if (record == null) {
        metrics.increment("block.event.orphan");
        log.debug("Fetch request for unknown block {}", blockHash);
        return;
      }
      record.recordRequest(t);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records the download without a size.
   */
  public void onDownloaded(String blockHash, Endpoint remote, Instant t) {
    onDownloaded(blockHash, remote, t, 0L);
  }

  /**
   * Records download completion, opening the record when absent. A non-zero size fills an unknown block size.
   */
  public void onDownloaded(String blockHash, Endpoint remote, Instant t, long blockSize) {
    Objects.requireNonNull(remote, "remote");
    Objects.requireNonNull(t, "t");
    lock.lock();
    try {
      if (isRetired(blockHash)) {
        return;
      }
      BlockRecord record = openRecord(blockHash);
      if (!record.recordDownload(remote, t, blockSize)) {
        metrics.increment("block.download.duplicate");
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records adoption and finalizes the record, emitting its sample when every milestone is present.
   *
   * @param blockHash adopted block
   * @param t adoption timestamp
   * @return the emitted sample, or empty when nothing was emitted
   */
  public Optional<BlockSample> onAdopted(String blockHash, Instant t) {
    Objects.requireNonNull(t, "t");
    BlockSample sample;
    lock.lock();
    try {
      if (isRetired(blockHash)) {
        return Optional.empty();
      }
      BlockRecord record = open.get(blockHash);
      if (record == null) {
        metrics.increment("block.event.orphan");
        log.debug("Adoption of unknown block {}", blockHash);
        return Optional.empty();
      }
      record.recordAdopted(t);
      open.remove(blockHash);

      if (!record.isComplete()) {
        retired.retire(blockHash, RetiredHashes.Outcome.INCOMPLETE);
        metrics.increment("block.record.incomplete");
        log.debug("Dropping adopted block with missing milestones: {}", record);
        return Optional.empty();
      }

      try {
        sample = toSample(record);
      } catch (IllegalArgumentException | DateTimeException | ArithmeticException ex) {
        retired.retire(blockHash, RetiredHashes.Outcome.INVALID);
        metrics.increment("block.sample.invalid");
        log.warn("Dropping block {} at slot {}: {}", blockHash, record.slotNo(), ex.getMessage());
        return Optional.empty();
      }
      retired.retire(blockHash, RetiredHashes.Outcome.EMITTED);
    } finally {
      lock.unlock();
    }
    emit(sample);
    return Optional.of(sample);
  }

  /**
   * Removes open records that are unadopted and older than the staleness threshold. Nothing is emitted.
   *
   * @param now current collector time
   * @return number of records removed
   */
  public int sweep(Instant now) {
    Objects.requireNonNull(now, "now");
    lock.lock();
    try {
      int swept = 0;
      Iterator<Map.Entry<String, BlockRecord>> it = open.entrySet().iterator();
      while (it.hasNext()) {
        BlockRecord record = it.next().getValue();
        if (record.isStale(now, staleAfter)) {
          it.remove();
          retired.retire(record.blockHash(), RetiredHashes.Outcome.SWEPT);
          swept++;
          metrics.increment("block.record.swept");
          log.debug("Swept stale {}", record);
        }
      }
      return swept;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Sweeps using the collector clock.
   *
   * @return number of records removed
   */
  public int sweep() {
    return sweep(clock.now());
  }

  /** Number of open (in-flight) records. */
  public int openRecords() {
    lock.lock();
    try {
      return open.size();
    } finally {
      lock.unlock();
    }
  }

  /** Indicates whether a record for {@code blockHash} is currently open. */
  public boolean isOpen(String blockHash) {
    lock.lock();
    try {
      return open.containsKey(blockHash);
    } finally {
      lock.unlock();
    }
  }

  private boolean isRetired(String blockHash) {
    Objects.requireNonNull(blockHash, "blockHash");
    if (retired.contains(blockHash)) {
      metrics.increment("block.event.retired");
      return true;
    }
    return false;
  }

  private BlockRecord openRecord(String blockHash) {
    BlockRecord record = open.get(blockHash);
    if (record == null) {
      record = new BlockRecord(blockHash, clock.now());
      open.put(blockHash, record);
      metrics.increment("block.record.opened");
    }
    return record;
  }

  private BlockSample toSample(BlockRecord record) {
    Sighting header = record.headerFirstSeen().orElseThrow();
    Instant requested = record.blockRequestSent().orElseThrow();
    Sighting download = record.blockDownloadCompleted().orElseThrow();
    Instant adopted = record.blockAdopted().orElseThrow();
    Instant slotTime = network.slotTime(record.slotNo());
    Endpoint local = metadata.localEndpoint();
    return new BlockSample(
        network.magic(),
        metadata.bpVersion(),
        record.blockNo(),
        record.slotNo(),
        record.blockHash(),
        record.blockSize(),
        header.remote().address(),
        header.remote().port(),
        slotTime,
        header.at(),
        requested,
        download.at(),
        adopted,
        Duration.between(slotTime, header.at()),
        Duration.between(header.at(), requested),
        Duration.between(requested, download.at()),
        Duration.between(download.at(), adopted),
        download.remote().address(),
        download.remote().port(),
        local.address(),
        local.port(),
        Duration.between(slotTime, adopted));
  }

  private void emit(BlockSample sample) {
    metrics.increment("block.sample.emitted");
    metrics.observe("block.delta.header.millis", sample.headerDelta().toMillis());
    metrics.observe("block.delta.request.millis", sample.blockReqDelta().toMillis());
    metrics.observe("block.delta.response.millis", sample.blockRspDelta().toMillis());
    metrics.observe("block.delta.adopt.millis", sample.blockAdoptDelta().toMillis());

    List<String> negative = sample.negativeDeltas();
    if (!negative.isEmpty()) {
      metrics.increment("block.delta.negative");
      log.warn("Block {} has negative {}; reporting as computed", sample.blockHash(), negative);
    }

    try {
      sink.accept(sample);
    } catch (RuntimeException ex) {
      metrics.increment("block.sample.sink.failed");
      log.warn("Sample sink rejected block {}", sample.blockHash(), ex);
    }
  }
}
