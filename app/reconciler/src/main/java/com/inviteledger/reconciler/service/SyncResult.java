package com.inviteledger.reconciler.service;

import java.time.Instant;

/**
 * Outcome of one directory sync pass.
 *
 * @param failure null when the pass succeeded
 */
public record SyncResult(
    Instant syncedAt, int fetched, int written, int linked, long cacheSize, String failure) {

  static SyncResult failed(Instant syncedAt, String failure) {
    return new SyncResult(syncedAt, 0, 0, 0, -1, failure);
  }

  public boolean succeeded() {
    return failure == null;
  }
}
