package com.inviteledger.reconciler.client.dto;

public record DeleteInviteRequest(String code) {}
