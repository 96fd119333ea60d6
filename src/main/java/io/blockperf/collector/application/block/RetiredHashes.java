package io.blockperf.collector.application.block;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded memory of block hashes that left the open table, evicting the oldest entry first.
 *
 * <p>Late or repeated events for a hash are suppressed only while the hash is among the last {@code capacity}
 * retired hashes. Once evicted, a new header or download for it opens a fresh record, and a sample for the same
 * block can be emitted again. The engine therefore assumes that no trace event arrives for a block after
 * {@code capacity} other blocks have been retired. The default of 8192 covers more than a day of mainnet blocks,
 * well beyond the staleness threshold; lower capacities weaken at-most-once emission accordingly.</p>
 *
 * <p>Not thread-safe; guarded by the engine lock.</p>
 */
final class RetiredHashes {

  enum Outcome {
    EMITTED,
    INCOMPLETE,
    INVALID,
    SWEPT
  }

  private final Map<String, Outcome> entries;

  RetiredHashes(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.entries = new LinkedHashMap<>(Math.min(capacity, 1_024), 0.75f, false) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Outcome> eldest) {
        return size() > capacity;
      }
    };
  }

  boolean contains(String hash) {
    return entries.containsKey(hash);
  }

  /**
   * Records the outcome for {@code hash}.
   *
   * @return previous outcome, or {@code null} when the hash was not retired yet
   */
  Outcome retire(String hash, Outcome outcome) {
    return entries.put(hash, outcome);
  }

  int size() {
    return entries.size();
  }
}
