package com.inviteledger.reconciler.resolver;

/** Names the chat platform currently shows for a user; either may be null. */
public record ChatProfile(String handle, String displayName) {}
