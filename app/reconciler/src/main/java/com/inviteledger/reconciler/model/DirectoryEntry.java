package com.inviteledger.reconciler.model;

import java.time.Duration;
import java.time.Instant;

public record DirectoryEntry(
    String remoteUserId,
    String remoteUsername,
    String linkedChatId,
    String email,
    Instant expiresAt,
    boolean disabled,
    boolean admin,
    Instant lastSyncedAt) {

  public boolean isStale(Instant now, Duration staleAfter) {
    return lastSyncedAt == null || lastSyncedAt.isBefore(now.minus(staleAfter));
  }
}
