package com.inviteledger.reconciler.service;

import java.time.Instant;

public record ExtendResult(
    String chatId,
    String remoteUsername,
    Instant newAccountExpiresAt,
    StepOutcome remoteExtend,
    StepOutcome localUpdate,
    boolean auditRecorded) {}
