/*
 * Where: reconciler domain model
 * What: one row of the local invite store, keyed by chat identity
 * Why: the store is the durable memory of every invite ever issued
 */
package com.inviteledger.reconciler.model;

import java.time.Instant;

public record InviteRecord(
    String chatId,
    String chatUsername,
    String inviteCode,
    String remoteUserId,
    String plan,
    Instant accountExpiresAt,
    Instant inviteExpiresAt,
    Instant lastNotifiedAt,
    InviteStatus status,
    Instant createdAt,
    Instant updatedAt) {

  /** A remote account has been confirmed for this record. */
  public boolean claimed() {
    return remoteUserId != null && !remoteUserId.isBlank();
  }

  public boolean disabled() {
    return status == InviteStatus.DISABLED;
  }

  /** The invite link can still be redeemed at {@code now}. */
  public boolean linkLive(Instant now) {
    return inviteCode != null && (inviteExpiresAt == null || inviteExpiresAt.isAfter(now));
  }
}
