package io.blockperf.collector.domain.block;

import io.blockperf.collector.domain.net.Endpoint;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Open, mutable record of one block's propagation milestones, keyed by block hash.
 *
 * <p>Every milestone is first-writer-wins: the {@code record*} methods return {@code false} and leave the record
 * untouched when the milestone is already set.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single correlation engine.</p>
 *
 * @since 0.1.0
 */
public final class BlockRecord {
  private final String blockHash;
  private final Instant openedAt;

  private long blockNo;
  private long slotNo;
  private long blockSize;
  private Sighting headerFirstSeen;
  private Instant blockRequestSent;
  private Sighting blockDownloadCompleted;
  private Instant blockAdopted;

  /**
   * Opens a record.
   *
   * @param blockHash canonical block key
   * @param openedAt collector clock reading when the record was created; drives staleness
   */
  public BlockRecord(String blockHash, Instant openedAt) {
    this.blockHash = Objects.requireNonNull(blockHash, "blockHash");
    this.openedAt = Objects.requireNonNull(openedAt, "openedAt");
  }

  /**
   * Sets the header milestone together with the block coordinates.
   *
   * @return {@code true} when the milestone was unset and is now recorded
   */
  public boolean recordHeader(long blockNo, long slotNo, long blockSize, Endpoint remote, Instant at) {
    if (headerFirstSeen != null) {
      return false;
    }
    this.headerFirstSeen = new Sighting(at, remote);
    this.blockNo = blockNo;
    this.slotNo = slotNo;
    fillSize(blockSize);
    return true;
  }

  /**
   * Sets the fetch request milestone.
   *
   * @return {@code true} when the milestone was unset and is now recorded
   */
  public boolean recordRequest(Instant at) {
    Objects.requireNonNull(at, "at");
    if (blockRequestSent != null) {
      return false;
    }
    this.blockRequestSent = at;
    return true;
  }

  /**
   * Sets the download milestone. A non-zero size fills {@link #blockSize()} when it is still unknown.
   *
   * @return {@code true} when the milestone was unset and is now recorded
   */
  public boolean recordDownload(Endpoint remote, Instant at, long size) {
    if (blockDownloadCompleted != null) {
      return false;
    }
    this.blockDownloadCompleted = new Sighting(at, remote);
    fillSize(size);
    return true;
  }

  /**
   * Sets the adoption milestone.
   *
   * @return {@code true} when the milestone was unset and is now recorded
   */
  public boolean recordAdopted(Instant at) {
    Objects.requireNonNull(at, "at");
    if (blockAdopted != null) {
      return false;
    }
    this.blockAdopted = at;
    return true;
  }

  /** Indicates whether all four milestones are present. */
  public boolean isComplete() {
    return headerFirstSeen != null
        && blockRequestSent != null
        && blockDownloadCompleted != null
        && blockAdopted != null;
  }

  /**
   * Indicates whether the record is unadopted and older than {@code threshold} at {@code now}.
   *
   * @param now current collector time
   * @param threshold staleness threshold
   * @return {@code true} when the record should be swept
   */
  public boolean isStale(Instant now, Duration threshold) {
    return blockAdopted == null && Duration.between(openedAt, now).compareTo(threshold) > 0;
  }

  private void fillSize(long size) {
    if (blockSize == 0 && size > 0) {
      blockSize = size;
    }
  }

  public String blockHash() {
    return blockHash;
  }

  public Instant openedAt() {
    return openedAt;
  }

  public long blockNo() {
    return blockNo;
  }

  public long slotNo() {
    return slotNo;
  }

  public long blockSize() {
    return blockSize;
  }

  public Optional<Sighting> headerFirstSeen() {
    return Optional.ofNullable(headerFirstSeen);
  }

  public Optional<Instant> blockRequestSent() {
    return Optional.ofNullable(blockRequestSent);
  }

  public Optional<Sighting> blockDownloadCompleted() {
    return Optional.ofNullable(blockDownloadCompleted);
  }

  public Optional<Instant> blockAdopted() {
    return Optional.ofNullable(blockAdopted);
  }

  @Override
  public String toString() {
    return "BlockRecord{" + blockHash + ", blockNo=" + blockNo + ", slotNo=" + slotNo
        + ", header=" + (headerFirstSeen != null)
        + ", request=" + (blockRequestSent != null)
        + ", download=" + (blockDownloadCompleted != null)
        + ", adopted=" + (blockAdopted != null) + '}';
  }
}
