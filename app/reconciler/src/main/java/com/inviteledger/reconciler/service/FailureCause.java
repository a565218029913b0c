package com.inviteledger.reconciler.service;

public enum FailureCause {
  NOT_FOUND,
  REMOTE_REJECTED,
  TRANSPORT,
  TIMEOUT,
  STORE
}
