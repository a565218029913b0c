package com.inviteledger.reconciler.service;

public enum DeliveryResult {
  DELIVERED,
  /** The chat platform refused the message, e.g. direct messages are closed. */
  UNREACHABLE
}
