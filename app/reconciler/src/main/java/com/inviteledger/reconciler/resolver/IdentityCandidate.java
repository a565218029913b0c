package com.inviteledger.reconciler.resolver;

/**
 * One possible pairing of a chat identity with a remote account.
 *
 * @param source short tag naming the lookup that produced the pairing
 */
public record IdentityCandidate(
    String chatId, String remoteUsername, MatchConfidence confidence, String source) {}
