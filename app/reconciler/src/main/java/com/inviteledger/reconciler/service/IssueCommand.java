package com.inviteledger.reconciler.service;

import java.time.Duration;

/**
 * @param accountDuration account lifetime; null takes the configured trial duration for trial
 *     plans and means non-expiring otherwise
 * @param linkValidity null takes the configured link validity
 */
public record IssueCommand(
    String actorId,
    String chatId,
    String chatUsername,
    String plan,
    Duration accountDuration,
    Duration linkValidity) {}
