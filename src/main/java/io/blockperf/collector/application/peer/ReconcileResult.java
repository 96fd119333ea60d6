package io.blockperf.collector.application.peer;

/**
 * Outcome of one reconciliation pass.
 *
 * @param added peers inserted because the OS reported a connection the tracker did not know
 * @param removed peers dropped because the OS no longer reports an established connection
 * @param total peers tracked after the pass
 * @since 0.1.0
 */
public record ReconcileResult(int added, int removed, int total) {

  /** Indicates whether the pass changed the peer map. */
  public boolean changed() {
    return added > 0 || removed > 0;
  }
}
