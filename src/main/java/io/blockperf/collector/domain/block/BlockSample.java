package io.blockperf.collector.domain.block;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, finalized propagation sample of one block.
 *
 * <p>Deltas are reported exactly as computed; negative values are possible under clock skew and are never
 * clamped.</p>
 *
 * @param magic network magic of the tracked chain
 * @param bpVersion collector version
 * @param blockNo block number
 * @param slotNo slot number
 * @param blockHash block hash
 * @param blockSize block body size in bytes, zero when unknown
 * @param headerRemoteAddr address of the peer the header was first seen from
 * @param headerRemotePort port of the peer the header was first seen from
 * @param slotTime wall-clock start of the block's slot
 * @param headerFirstSeen instant the header was first seen
 * @param blockRequestSent instant the body was requested
 * @param blockDownloadCompleted instant the body finished downloading
 * @param blockAdopted instant the block was adopted
 * @param headerDelta headerFirstSeen minus slotTime
 * @param blockReqDelta blockRequestSent minus headerFirstSeen
 * @param blockRspDelta blockDownloadCompleted minus blockRequestSent
 * @param blockAdoptDelta blockAdopted minus blockDownloadCompleted
 * @param blockRemoteAddress address of the peer the body was downloaded from
 * @param blockRemotePort port of the peer the body was downloaded from
 * @param blockLocalAddress configured local address of the tracked node
 * @param blockLocalPort configured local port of the tracked node
 * @param blockG blockAdopted minus slotTime
 * @since 0.1.0
 */
public record BlockSample(
    long magic,
    String bpVersion,
    long blockNo,
    long slotNo,
    String blockHash,
    long blockSize,
    String headerRemoteAddr,
    int headerRemotePort,
    Instant slotTime,
    Instant headerFirstSeen,
    Instant blockRequestSent,
    Instant blockDownloadCompleted,
    Instant blockAdopted,
    Duration headerDelta,
    Duration blockReqDelta,
    Duration blockRspDelta,
    Duration blockAdoptDelta,
    String blockRemoteAddress,
    int blockRemotePort,
    String blockLocalAddress,
    int blockLocalPort,
    Duration blockG) {

  public BlockSample {
    Objects.requireNonNull(bpVersion, "bpVersion");
    Objects.requireNonNull(blockHash, "blockHash");
    Objects.requireNonNull(headerRemoteAddr, "headerRemoteAddr");
    Objects.requireNonNull(slotTime, "slotTime");
    Objects.requireNonNull(headerFirstSeen, "headerFirstSeen");
    Objects.requireNonNull(blockRequestSent, "blockRequestSent");
    Objects.requireNonNull(blockDownloadCompleted, "blockDownloadCompleted");
    Objects.requireNonNull(blockAdopted, "blockAdopted");
    Objects.requireNonNull(headerDelta, "headerDelta");
    Objects.requireNonNull(blockReqDelta, "blockReqDelta");
    Objects.requireNonNull(blockRspDelta, "blockRspDelta");
    Objects.requireNonNull(blockAdoptDelta, "blockAdoptDelta");
    Objects.requireNonNull(blockRemoteAddress, "blockRemoteAddress");
    Objects.requireNonNull(blockLocalAddress, "blockLocalAddress");
    Objects.requireNonNull(blockG, "blockG");
  }

  /**
   * Names the deltas that came out negative, in field order.
   *
   * @return possibly empty list of delta field names
   */
  public List<String> negativeDeltas() {
    List<String> names = new ArrayList<>(4);
    if (headerDelta.isNegative()) {
      names.add("headerDelta");
    }
    if (blockReqDelta.isNegative()) {
      names.add("blockReqDelta");
    }
    if (blockRspDelta.isNegative()) {
      names.add("blockRspDelta");
    }
    if (blockAdoptDelta.isNegative()) {
      names.add("blockAdoptDelta");
    }
    return names;
  }
}
