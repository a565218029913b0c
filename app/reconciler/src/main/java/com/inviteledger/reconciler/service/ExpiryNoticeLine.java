package com.inviteledger.reconciler.service;

public record ExpiryNoticeLine(
    String chatId, String chatUsername, long daysRemaining, Result result) {

  public enum Result {
    NOTIFIED,
    FAILED,
    NOT_DUE,
    DEDUPLICATED
  }
}
