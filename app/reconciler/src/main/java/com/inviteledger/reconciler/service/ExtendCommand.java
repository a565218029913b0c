package com.inviteledger.reconciler.service;

import java.time.Duration;

/** At least one of {@code chatId} and {@code remoteUsername} must be given. */
public record ExtendCommand(
    String actorId, String chatId, String remoteUsername, Duration duration) {}
