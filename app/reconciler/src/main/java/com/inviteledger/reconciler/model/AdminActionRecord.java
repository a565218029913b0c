package com.inviteledger.reconciler.model;

import java.time.Instant;
import java.util.UUID;

/** Append-only audit entry for an administrative lifecycle operation. */
public record AdminActionRecord(
    UUID id,
    String actorId,
    AdminActionKind kind,
    String targetChatId,
    String targetRemoteUsername,
    String detailJson,
    Instant performedAt) {}
