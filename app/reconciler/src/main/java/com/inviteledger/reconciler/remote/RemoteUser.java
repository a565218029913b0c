package com.inviteledger.reconciler.remote;

import java.time.Instant;

/** A user as reported by the provisioning service directory. */
public record RemoteUser(
    String id,
    String username,
    String email,
    Instant expiresAt,
    boolean disabled,
    boolean admin,
    String linkedChatId) {}
