package com.inviteledger.reconciler.service;

/** Delivery capability supplied by the chat layer. */
public interface ExpiryNotifier {

  /**
   * Sends a direct message. Implementations return {@link DeliveryResult#UNREACHABLE} for a known
   * refusal and may throw for anything unexpected; both leave the record eligible for a retry.
   */
  DeliveryResult send(String chatId, String message);

  /** Receives the summary of every expiry pass, e.g. for an admin channel. */
  void publishSummary(ExpiryPassSummary summary);
}
