package com.inviteledger.reconciler.service;

public record RemovalCommand(String actorId, String identifier, String reason) {}
